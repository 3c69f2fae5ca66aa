package com.fhirsls.core.rules;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reference code list tied to one or more sensitive topics, as read from a FHIR ValueSet.
 */
public record TopicSource(
        String id,
        List<TopicLabel> topics,
        List<MemberCode> members,
        Instant date,
        Instant expansionTimestamp
) {

    public TopicSource {
        Objects.requireNonNull(id, "Source ID cannot be null");
        topics = topics != null ? List.copyOf(topics) : List.of();
        members = members != null ? List.copyOf(members) : List.of();
    }

    /**
     * The expansion timestamp when present, otherwise the plain source date.
     */
    public Optional<Instant> effectiveDate() {
        if (expansionTimestamp != null) {
            return Optional.of(expansionTimestamp);
        }
        return Optional.ofNullable(date);
    }
}
