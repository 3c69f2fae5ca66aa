package com.fhirsls.core.fhir;

/**
 * FHIR URLs, systems and field names shared by the labeling engine.
 */
public final class FhirTerms {

    public static final String LAST_SOURCE_SYNC_URL =
            "http://hl7.org/fhir/StructureDefinition/lastSourceSync";

    public static final String CONFIDENTIALITY_SYSTEM =
            "http://terminology.hl7.org/CodeSystem/v3-Confidentiality";
    public static final String RESTRICTED_CODE = "R";
    public static final String RESTRICTED_DISPLAY = "restricted";

    public static final String PROCESSING_TAG_SYSTEM =
            "http://example.org/fhir/CodeSystem/sls-processing";
    public static final String PROCESSING_TAG_CODE = "sls-tagged";
    public static final String PROCESSING_TAG_DISPLAY = "SLS Security Labeled";

    public static final String PROCESSING_SUMMARY_URL =
            "http://example.org/fhir/StructureDefinition/processing-summary";

    public static final String RESOURCE_TYPE = "resourceType";
    public static final String BUNDLE = "Bundle";
    public static final String VALUE_SET = "ValueSet";
    public static final String PARAMETERS = "Parameters";
    public static final String OPERATION_OUTCOME = "OperationOutcome";

    public static final String FOCUS_CONTEXT = "focus";

    private FhirTerms() {
    }
}
