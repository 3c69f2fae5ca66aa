package com.fhirsls.core.rules;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A validated topic source reduced to what the rule table needs: its topics and the flat
 * set of member codes every topic applies to.
 */
public record CompiledSource(
        String id,
        List<TopicLabel> topics,
        Set<CodeIdentity> codes,
        Instant effectiveDate
) {

    public CompiledSource {
        Objects.requireNonNull(id, "Source ID cannot be null");
        topics = topics != null ? List.copyOf(topics) : List.of();
        // Set.copyOf loses ordering; keep the caller's iteration order
        codes = codes != null ? Collections.unmodifiableSet(new LinkedHashSet<>(codes)) : Set.of();
        if (topics.isEmpty()) {
            throw new IllegalArgumentException("Compiled source must have at least one topic");
        }
        if (codes.isEmpty()) {
            throw new IllegalArgumentException("Compiled source must have at least one code");
        }
    }
}
