package com.fhirsls.core.scan;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps a JSON node onto its {@link NodeShape}.
 */
public final class NodeClassifier {

    private NodeClassifier() {
    }

    public static NodeShape classify(JsonNode node) {
        if (node == null) {
            return NodeShape.SCALAR;
        }
        if (node.isArray()) {
            return NodeShape.CONTAINER;
        }
        if (!node.isObject()) {
            return NodeShape.SCALAR;
        }
        if (isNonBlankText(node.get("system")) && isNonBlankText(node.get("code"))) {
            return NodeShape.LEAF_CODE;
        }
        JsonNode coding = node.get("coding");
        if (coding != null && coding.isArray()) {
            return NodeShape.CONCEPT_WRAPPER;
        }
        return NodeShape.CONTAINER;
    }

    private static boolean isNonBlankText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }
}
