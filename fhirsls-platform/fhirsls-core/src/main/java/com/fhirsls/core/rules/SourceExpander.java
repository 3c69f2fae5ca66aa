package com.fhirsls.core.rules;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves the member codes of a ValueSet that arrives without an expansion.
 *
 * Called synchronously, at most once per source per compilation request. Implementations
 * report failure through {@link ExpansionResult#failure(String)}; a thrown runtime exception
 * is treated the same way and rejects only the source being expanded.
 */
@FunctionalInterface
public interface SourceExpander {

    ExpansionResult expand(JsonNode valueSet);

    static SourceExpander unavailable() {
        return valueSet -> ExpansionResult.failure("No expansion service configured");
    }
}
