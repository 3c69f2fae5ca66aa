package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.rules.TopicLabel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * What happened to one bundle entry during tagging.
 *
 * {@code entry} is this request's private copy of the input entry; for processed records its
 * resource carries the applied labels and fresh marker.
 */
public record ProcessingOutcome(
        int index,
        JsonNode entry,
        Disposition disposition,
        Set<TopicLabel> matched
) {

    public ProcessingOutcome {
        Objects.requireNonNull(entry, "Entry cannot be null");
        Objects.requireNonNull(disposition, "Disposition cannot be null");
        matched = matched != null ? Collections.unmodifiableSet(new LinkedHashSet<>(matched)) : Set.of();
    }

    public static ProcessingOutcome processed(int index, JsonNode entry, Set<TopicLabel> matched) {
        return new ProcessingOutcome(index, entry, Disposition.PROCESSED, matched);
    }

    public static ProcessingOutcome skipped(int index, JsonNode entry) {
        return new ProcessingOutcome(index, entry, Disposition.SKIPPED, Set.of());
    }

    public static ProcessingOutcome unsupported(int index, JsonNode entry) {
        return new ProcessingOutcome(index, entry, Disposition.UNSUPPORTED, Set.of());
    }

    public boolean isLabeled() {
        return disposition == Disposition.PROCESSED && !matched.isEmpty();
    }

    public JsonNode resource() {
        return entry.path("resource");
    }

    public enum Disposition {
        PROCESSED,
        SKIPPED,
        UNSUPPORTED
    }
}
