package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirDates;
import com.fhirsls.core.fhir.FhirTerms;
import com.fhirsls.core.rules.LabelKey;
import com.fhirsls.core.rules.TopicLabel;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the output bundle of a tagging request from its per-entry outcomes.
 *
 * Outcomes are reduced here by a single writer, in input order, whatever order they were
 * computed in. The collection label set on the bundle's meta is the union of every emitted
 * resource's {@code meta.security}, deduplicated by (system, code).
 */
public class BundleAssembler {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final List<String> PRESERVED_BEFORE_META = List.of("id", "type", "identifier", "timestamp");
    private static final List<String> PRESERVED_AFTER_META = List.of("total", "link");

    private final Clock clock;

    public BundleAssembler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public TaggingResult assemble(JsonNode input,
                                  Collection<ProcessingOutcome> outcomes,
                                  OutputMode mode,
                                  UnsupportedRecordPolicy policy,
                                  long tableVersion) {
        Objects.requireNonNull(outcomes, "Outcomes cannot be null");
        Objects.requireNonNull(mode, "Output mode cannot be null");
        Objects.requireNonNull(policy, "Unsupported record policy cannot be null");

        List<ProcessingOutcome> ordered = new ArrayList<>(outcomes);
        ordered.sort(Comparator.comparingInt(ProcessingOutcome::index));

        List<JsonNode> emitted = new ArrayList<>();
        for (ProcessingOutcome outcome : ordered) {
            if (mode == OutputMode.NARROWED) {
                if (outcome.disposition() == ProcessingOutcome.Disposition.PROCESSED) {
                    emitted.add(updateEntry(outcome.resource()));
                }
            } else if (outcome.disposition() != ProcessingOutcome.Disposition.UNSUPPORTED
                    || policy != UnsupportedRecordPolicy.DROP) {
                emitted.add(outcome.entry());
            }
        }

        List<TopicLabel> labels = collectLabels(emitted.stream().map(e -> e.path("resource")).toList());
        ProcessingCounters counters = ProcessingCounters.of(ordered);

        ObjectNode bundle = JSON.objectNode();
        bundle.put(FhirTerms.RESOURCE_TYPE, FhirTerms.BUNDLE);
        if (mode == OutputMode.NARROWED) {
            bundle.put("type", "batch");
            bundle.set("meta", meta(labels));
        } else {
            for (String field : PRESERVED_BEFORE_META) {
                if (input != null && input.hasNonNull(field)) {
                    bundle.set(field, input.get(field).deepCopy());
                }
            }
            if (!bundle.has("type")) {
                bundle.put("type", "collection");
            }
            bundle.set("meta", meta(labels));
            for (String field : PRESERVED_AFTER_META) {
                if (input != null && input.hasNonNull(field)) {
                    bundle.set(field, input.get(field).deepCopy());
                }
            }
        }

        ArrayNode entries = bundle.putArray("entry");
        emitted.forEach(entries::add);
        bundle.putArray("extension").add(summary(counters, policy == UnsupportedRecordPolicy.REPORT));

        return new TaggingResult(bundle, labels, counters, tableVersion);
    }

    /**
     * The distinct security labels across the given resources, first occurrence wins.
     */
    public static List<TopicLabel> collectLabels(Collection<JsonNode> resources) {
        Map<LabelKey, TopicLabel> labels = new LinkedHashMap<>();
        for (JsonNode resource : resources) {
            for (JsonNode security : resource.path("meta").path("security")) {
                TopicLabel.fromCoding(security).ifPresent(l -> labels.putIfAbsent(l.key(), l));
            }
        }
        return List.copyOf(labels.values());
    }

    private ObjectNode updateEntry(JsonNode resource) {
        ObjectNode entry = JSON.objectNode();
        ObjectNode request = entry.putObject("request");
        String type = resource.path(FhirTerms.RESOURCE_TYPE).asText();
        String id = resource.path("id").asText(null);
        if (id != null && !id.isBlank()) {
            request.put("method", "PUT");
            request.put("url", type + "/" + id);
        } else {
            request.put("method", "POST");
            request.put("url", type);
        }
        entry.set("resource", resource);
        return entry;
    }

    private ObjectNode meta(List<TopicLabel> labels) {
        ObjectNode meta = JSON.objectNode();
        meta.put("lastUpdated", FhirDates.format(clock.instant()));
        ObjectNode tag = meta.putArray("tag").addObject();
        tag.put("system", FhirTerms.PROCESSING_TAG_SYSTEM);
        tag.put("code", FhirTerms.PROCESSING_TAG_CODE);
        tag.put("display", FhirTerms.PROCESSING_TAG_DISPLAY);
        if (!labels.isEmpty()) {
            ArrayNode security = meta.putArray("security");
            labels.forEach(l -> security.add(l.toCoding()));
        }
        return meta;
    }

    private static ObjectNode summary(ProcessingCounters counters, boolean reportUnsupported) {
        ObjectNode summary = JSON.objectNode();
        summary.put("url", FhirTerms.PROCESSING_SUMMARY_URL);
        ArrayNode values = summary.putArray("extension");
        values.addObject().put("url", "analyzed").put("valueInteger", counters.analyzed());
        values.addObject().put("url", "labeled").put("valueInteger", counters.labeled());
        values.addObject().put("url", "skipped").put("valueInteger", counters.skipped());
        if (reportUnsupported) {
            values.addObject().put("url", "unsupported").put("valueInteger", counters.unsupported());
        }
        return summary;
    }
}
