package com.fhirsls.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.fhir.FhirDates;
import com.fhirsls.core.fhir.FhirTerms;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a FHIR ValueSet into a {@link TopicSource}, collecting every validation problem
 * rather than stopping at the first.
 */
public class TopicSourceReader {

    private final int maxMemberDepth;

    public TopicSourceReader(int maxMemberDepth) {
        if (maxMemberDepth < 1) {
            throw new IllegalArgumentException("Max member depth must be positive");
        }
        this.maxMemberDepth = maxMemberDepth;
    }

    public ReadResult read(JsonNode valueSet) {
        String id = valueSet.path("id").asText(null);
        String label = id != null && !id.isBlank() ? id : "unknown";
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("ValueSet missing required field: id");
        }

        List<TopicLabel> topics = extractTopics(valueSet);
        if (topics.isEmpty()) {
            errors.add("ValueSet " + label
                    + " missing topic: must have either topic[0].coding[0] or useContext with code=focus");
        }

        List<MemberCode> members = List.of();
        JsonNode contains = valueSet.path("expansion").path("contains");
        if (!contains.isArray()) {
            errors.add("ValueSet " + label + " missing expansion.contains");
        } else {
            try {
                members = readMembers(contains, 1);
                if (members.isEmpty()) {
                    errors.add("ValueSet " + label + " expansion.contains has no member codes");
                }
            } catch (MemberTreeTooDeepException e) {
                errors.add("ValueSet " + label + " " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            return ReadResult.invalid(errors);
        }

        Instant date = FhirDates.parse(valueSet.path("date").asText(null)).orElse(null);
        Instant expansionTimestamp = FhirDates.parse(
                valueSet.path("expansion").path("timestamp").asText(null)).orElse(null);
        return ReadResult.valid(new TopicSource(id, topics, members, date, expansionTimestamp));
    }

    /**
     * Topics from the primary {@code topic[0].coding[0]} together with every coding of every
     * {@code useContext} whose code is "focus", deduplicated by label identity.
     */
    public List<TopicLabel> extractTopics(JsonNode valueSet) {
        Map<LabelKey, TopicLabel> topics = new LinkedHashMap<>();

        JsonNode primary = valueSet.path("topic").path(0).path("coding").path(0);
        TopicLabel.fromCoding(primary).ifPresent(t -> topics.putIfAbsent(t.key(), t));

        for (JsonNode context : valueSet.path("useContext")) {
            if (!FhirTerms.FOCUS_CONTEXT.equals(context.path("code").path("code").asText(null))) {
                continue;
            }
            for (JsonNode coding : context.path("valueCodeableConcept").path("coding")) {
                TopicLabel.fromCoding(coding).ifPresent(t -> topics.putIfAbsent(t.key(), t));
            }
        }
        return List.copyOf(topics.values());
    }

    private List<MemberCode> readMembers(JsonNode contains, int depth) {
        if (depth > maxMemberDepth) {
            throw new MemberTreeTooDeepException(maxMemberDepth);
        }
        List<MemberCode> members = new ArrayList<>();
        for (JsonNode item : contains) {
            if (!item.isObject()) {
                continue;
            }
            List<MemberCode> nested = item.path("contains").isArray()
                    ? readMembers(item.path("contains"), depth + 1)
                    : List.of();
            members.add(new MemberCode(
                    item.path("system").asText(null),
                    item.path("code").asText(null),
                    item.path("display").asText(null),
                    nested));
        }
        return members;
    }

    /**
     * Outcome of reading one ValueSet: either a source or the reasons it was rejected.
     */
    public record ReadResult(TopicSource source, List<String> errors) {

        public ReadResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }

        static ReadResult valid(TopicSource source) {
            return new ReadResult(source, List.of());
        }

        static ReadResult invalid(List<String> errors) {
            return new ReadResult(null, errors);
        }

        public boolean isValid() {
            return source != null;
        }
    }
}
