package com.fhirsls.core.tagging;

import com.fhirsls.core.scan.CodeScanner;

import java.util.Objects;
import java.util.Set;

/**
 * Tunables for a {@link TaggingEngine}.
 */
public record TaggingOptions(
        Set<String> supportedResourceTypes,
        UnsupportedRecordPolicy unsupportedPolicy,
        int maxScanDepth,
        boolean parallel
) {

    /**
     * US Core clinical resource types that may carry sensitive codes.
     */
    public static final Set<String> DEFAULT_SUPPORTED_TYPES = Set.of(
            "AllergyIntolerance", "Condition", "Procedure", "Immunization",
            "MedicationRequest", "Medication", "CarePlan", "CareTeam", "Goal",
            "Observation", "DiagnosticReport", "DocumentReference",
            "QuestionnaireResponse", "Specimen", "Encounter", "ServiceRequest"
    );

    public TaggingOptions {
        supportedResourceTypes = supportedResourceTypes != null && !supportedResourceTypes.isEmpty()
                ? Set.copyOf(supportedResourceTypes)
                : DEFAULT_SUPPORTED_TYPES;
        Objects.requireNonNull(unsupportedPolicy, "Unsupported record policy cannot be null");
        if (maxScanDepth < 1) {
            throw new IllegalArgumentException("Max scan depth must be positive");
        }
    }

    public static TaggingOptions defaults() {
        return new TaggingOptions(DEFAULT_SUPPORTED_TYPES, UnsupportedRecordPolicy.PASS_THROUGH,
                CodeScanner.DEFAULT_MAX_DEPTH, false);
    }

    public TaggingOptions withUnsupportedPolicy(UnsupportedRecordPolicy policy) {
        return new TaggingOptions(supportedResourceTypes, policy, maxScanDepth, parallel);
    }

    public TaggingOptions withParallel(boolean parallel) {
        return new TaggingOptions(supportedResourceTypes, unsupportedPolicy, maxScanDepth, parallel);
    }

    public TaggingOptions withMaxScanDepth(int maxScanDepth) {
        return new TaggingOptions(supportedResourceTypes, unsupportedPolicy, maxScanDepth, parallel);
    }
}
