package com.fhirsls.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A sensitive-topic classification tag applied to records as a security label.
 *
 * Two labels denote the same tag when their {@link #key()} is equal; display is informational.
 */
public record TopicLabel(String system, String code, String display) {

    public TopicLabel {
        Objects.requireNonNull(code, "Code cannot be null");
        if (code.isBlank()) {
            throw new IllegalArgumentException("Code cannot be blank");
        }
        if (display == null || display.isBlank()) {
            display = code;
        }
    }

    public static TopicLabel of(String system, String code) {
        return new TopicLabel(system, code, null);
    }

    public LabelKey key() {
        return new LabelKey(system, code);
    }

    /**
     * Reads a FHIR Coding. Returns empty when the coding carries no code.
     */
    public static Optional<TopicLabel> fromCoding(JsonNode coding) {
        if (coding == null || !coding.isObject()) {
            return Optional.empty();
        }
        String code = coding.path("code").asText(null);
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new TopicLabel(
                coding.path("system").asText(null),
                code,
                coding.path("display").asText(null)));
    }

    public ObjectNode toCoding() {
        ObjectNode coding = JsonNodeFactory.instance.objectNode();
        if (system != null) {
            coding.put("system", system);
        }
        coding.put("code", code);
        coding.put("display", display);
        return coding;
    }

    @Override
    public String toString() {
        return (system != null ? system : "") + "|" + code;
    }
}
