package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirDates;
import com.fhirsls.core.fhir.FhirTerms;
import com.fhirsls.core.rules.LabelKey;
import com.fhirsls.core.rules.TopicLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Writes matched topics into a record's {@code meta.security} and stamps its lastSourceSync marker.
 *
 * Labels are appended only when their (system, code) is not already present, and any
 * duplicates already in the record are collapsed, so applying twice changes nothing but
 * the marker. The marker is replaced on every call, whether or not labels were added.
 */
public class LabelApplier {

    private static final Logger log = LoggerFactory.getLogger(LabelApplier.class);

    public static final TopicLabel RESTRICTED = new TopicLabel(
            FhirTerms.CONFIDENTIALITY_SYSTEM, FhirTerms.RESTRICTED_CODE, FhirTerms.RESTRICTED_DISPLAY);

    private final Clock clock;

    public LabelApplier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Applies the matched topics and stamps a fresh marker.
     *
     * @return the labels actually appended, in order
     */
    public List<TopicLabel> apply(ObjectNode record, Collection<TopicLabel> matched) {
        Objects.requireNonNull(record, "Record cannot be null");
        Objects.requireNonNull(matched, "Matched topics cannot be null");

        List<TopicLabel> added = new ArrayList<>();
        if (!matched.isEmpty()) {
            ArrayNode security = securityOf(record);
            Set<LabelKey> present = collapseDuplicates(security);

            if (present.add(RESTRICTED.key())) {
                security.add(RESTRICTED.toCoding());
                added.add(RESTRICTED);
            }
            for (TopicLabel topic : matched) {
                if (present.add(topic.key())) {
                    security.add(topic.toCoding());
                    added.add(topic);
                }
            }
        } else if (record.path("meta").path("security") instanceof ArrayNode security) {
            collapseDuplicates(security);
        }

        stampMarker(record);
        return added;
    }

    /**
     * Removes any lastSourceSync extension and appends exactly one stamped with the current time.
     */
    public void stampMarker(ObjectNode record) {
        ArrayNode extensions = arrayField(record, metaOf(record), "extension");
        for (int i = extensions.size() - 1; i >= 0; i--) {
            if (FhirTerms.LAST_SOURCE_SYNC_URL.equals(extensions.get(i).path("url").asText(null))) {
                extensions.remove(i);
            }
        }
        ObjectNode marker = extensions.addObject();
        marker.put("url", FhirTerms.LAST_SOURCE_SYNC_URL);
        marker.put("valueDateTime", FhirDates.format(clock.instant()));
    }

    private static ObjectNode metaOf(ObjectNode record) {
        JsonNode meta = record.get("meta");
        if (meta instanceof ObjectNode objectMeta) {
            return objectMeta;
        }
        if (meta != null && !meta.isNull()) {
            log.warn("Replacing non-object meta ({}) on {}/{}", meta.getNodeType(), typeOf(record), idOf(record));
        }
        return record.putObject("meta");
    }

    private static ArrayNode securityOf(ObjectNode record) {
        return arrayField(record, metaOf(record), "security");
    }

    /**
     * Returns {@code meta.<field>} as an array. A lone object is kept as the first element;
     * any other non-array value is logged and replaced.
     */
    private static ArrayNode arrayField(ObjectNode record, ObjectNode meta, String field) {
        JsonNode existing = meta.get(field);
        if (existing instanceof ArrayNode array) {
            return array;
        }
        ArrayNode array = meta.putArray(field);
        if (existing instanceof ObjectNode single) {
            array.add(single);
        } else if (existing != null && !existing.isNull()) {
            log.warn("Replacing non-array meta.{} ({}) on {}/{}",
                    field, existing.getNodeType(), typeOf(record), idOf(record));
        }
        return array;
    }

    private static String typeOf(ObjectNode record) {
        return record.path(FhirTerms.RESOURCE_TYPE).asText("unknown");
    }

    private static String idOf(ObjectNode record) {
        return record.path("id").asText("unknown");
    }

    /**
     * Drops repeated (system, code) entries in place, keeping the first, and returns the keys present.
     */
    private static Set<LabelKey> collapseDuplicates(ArrayNode security) {
        Set<LabelKey> present = new HashSet<>();
        for (int i = 0; i < security.size(); ) {
            TopicLabel existing = TopicLabel.fromCoding(security.get(i)).orElse(null);
            if (existing != null && !present.add(existing.key())) {
                security.remove(i);
            } else {
                i++;
            }
        }
        return present;
    }
}
