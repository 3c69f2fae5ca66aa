package com.fhirsls.core.rules;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Result of asking a terminology service to expand a ValueSet definition.
 */
public record ExpansionResult(
        boolean success,
        JsonNode valueSet,
        String failureReason
) {

    public static ExpansionResult success(JsonNode valueSet) {
        Objects.requireNonNull(valueSet, "Expanded ValueSet cannot be null");
        return new ExpansionResult(true, valueSet, null);
    }

    public static ExpansionResult failure(String reason) {
        return new ExpansionResult(false, null, reason);
    }
}
