package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.rules.TopicLabel;

import java.util.List;
import java.util.Objects;

/**
 * Output of one tagging request.
 */
public record TaggingResult(
        ObjectNode bundle,
        List<TopicLabel> collectionLabels,
        ProcessingCounters counters,
        long tableVersion
) {

    public TaggingResult {
        Objects.requireNonNull(bundle, "Bundle cannot be null");
        Objects.requireNonNull(counters, "Counters cannot be null");
        collectionLabels = collectionLabels != null ? List.copyOf(collectionLabels) : List.of();
    }
}
