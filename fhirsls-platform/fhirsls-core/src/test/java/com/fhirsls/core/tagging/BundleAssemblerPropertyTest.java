package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.rules.LabelKey;
import com.fhirsls.core.rules.TopicLabel;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static com.fhirsls.core.FhirFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for output bundle assembly.
 */
class BundleAssemblerPropertyTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private final BundleAssembler assembler = new BundleAssembler(Clock.fixed(NOW, ZoneOffset.UTC));

    /**
     * Property: the collection label set is the deduplicated union of the entries' labels,
     * whatever order the outcomes arrive in.
     */
    @Property(tries = 100)
    void collectionLabels_areUnionRegardlessOfOutcomeOrder(
            @ForAll("labelSets") List<List<TopicLabel>> perRecord,
            @ForAll Random random) {

        List<ProcessingOutcome> outcomes = new ArrayList<>();
        Set<LabelKey> expected = new HashSet<>();
        for (int i = 0; i < perRecord.size(); i++) {
            ObjectNode resource = condition("c" + i);
            ArrayNode security = resource.putObject("meta").putArray("security");
            perRecord.get(i).forEach(l -> security.add(l.toCoding()));
            perRecord.get(i).forEach(l -> expected.add(l.key()));
            outcomes.add(ProcessingOutcome.processed(i, entry(resource), Set.copyOf(perRecord.get(i))));
        }
        Collections.shuffle(outcomes, random);

        TaggingResult result = assembler.assemble(bundle(), outcomes, OutputMode.NARROWED,
                UnsupportedRecordPolicy.PASS_THROUGH, 1L);

        assertThat(result.collectionLabels()).extracting(TopicLabel::key).containsExactlyInAnyOrderElementsOf(expected);
        assertThat(result.collectionLabels()).extracting(TopicLabel::key).doesNotHaveDuplicates();
        List<String> order = new ArrayList<>();
        result.bundle().path("entry").forEach(e -> order.add(e.path("resource").path("id").asText()));
        List<String> expectedOrder = new ArrayList<>();
        for (int i = 0; i < perRecord.size(); i++) {
            expectedOrder.add("c" + i);
        }
        assertThat(order).isEqualTo(expectedOrder);
    }

    @Provide
    Arbitrary<List<List<TopicLabel>>> labelSets() {
        return Arbitraries.of(PSY, ETH, HIV, LabelApplier.RESTRICTED)
                .list().ofMaxSize(4)
                .list().ofMinSize(1).ofMaxSize(6);
    }

    private static ObjectNode entry(JsonNode resource) {
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.set("resource", resource);
        return entry;
    }

    // ==================== Narrowed ====================

    @Test
    void narrowedBundle_isBatchOfUpdates() {
        ObjectNode withId = condition("c1");
        ObjectNode withoutId = condition("ignored");
        withoutId.remove("id");
        List<ProcessingOutcome> outcomes = List.of(
                ProcessingOutcome.processed(0, entry(withId), Set.of()),
                ProcessingOutcome.skipped(1, entry(condition("c2"))),
                ProcessingOutcome.processed(2, entry(withoutId), Set.of()));

        ObjectNode bundle = assembler.assemble(bundle(), outcomes, OutputMode.NARROWED,
                UnsupportedRecordPolicy.PASS_THROUGH, 3L).bundle();

        assertThat(bundle.path("type").asText()).isEqualTo("batch");
        assertThat(bundle.path("entry")).hasSize(2);
        assertThat(bundle.at("/entry/0/request/method").asText()).isEqualTo("PUT");
        assertThat(bundle.at("/entry/0/request/url").asText()).isEqualTo("Condition/c1");
        assertThat(bundle.at("/entry/1/request/method").asText()).isEqualTo("POST");
        assertThat(bundle.at("/entry/1/request/url").asText()).isEqualTo("Condition");
        assertThat(bundle.at("/meta/lastUpdated").asText()).isEqualTo("2025-01-01T12:00:00Z");
        assertThat(bundle.at("/meta/tag/0/code").asText()).isEqualTo("sls-tagged");
        assertThat(bundle.path("meta").has("security")).isFalse();
    }

    @Test
    void summaryExtension_carriesCounters() {
        List<ProcessingOutcome> outcomes = List.of(
                ProcessingOutcome.processed(0, entry(condition("c1")), Set.of(PSY)),
                ProcessingOutcome.processed(1, entry(condition("c2")), Set.of()),
                ProcessingOutcome.skipped(2, entry(condition("c3"))),
                ProcessingOutcome.unsupported(3, entry(resource("Patient", "p1"))));

        TaggingResult result = assembler.assemble(bundle(), outcomes, OutputMode.NARROWED,
                UnsupportedRecordPolicy.REPORT, 1L);

        assertThat(result.counters()).isEqualTo(new ProcessingCounters(2, 1, 1, 1));
        JsonNode summary = result.bundle().at("/extension/0");
        assertThat(summary.path("url").asText()).isEqualTo("http://example.org/fhir/StructureDefinition/processing-summary");
        assertThat(summary.path("extension")).hasSize(4);
        assertThat(summary.at("/extension/0/valueInteger").asInt()).isEqualTo(2);
        assertThat(summary.at("/extension/1/valueInteger").asInt()).isEqualTo(1);
        assertThat(summary.at("/extension/2/valueInteger").asInt()).isEqualTo(1);
        assertThat(summary.at("/extension/3/url").asText()).isEqualTo("unsupported");
    }

    // ==================== Full ====================

    @Test
    void fullBundle_preservesEnvelopeAndPositions() {
        ObjectNode input = bundle();
        input.put("id", "b1");
        input.put("type", "searchset");
        input.put("total", 3);
        input.putArray("link").addObject().put("relation", "self").put("url", "http://example.org/Condition");
        List<ProcessingOutcome> outcomes = List.of(
                ProcessingOutcome.skipped(1, entry(condition("c2"))),
                ProcessingOutcome.unsupported(2, entry(resource("Patient", "p1"))),
                ProcessingOutcome.processed(0, entry(condition("c1")), Set.of()));

        ObjectNode bundle = assembler.assemble(input, outcomes, OutputMode.FULL,
                UnsupportedRecordPolicy.PASS_THROUGH, 1L).bundle();

        assertThat(bundle.path("id").asText()).isEqualTo("b1");
        assertThat(bundle.path("type").asText()).isEqualTo("searchset");
        assertThat(bundle.path("total").asInt()).isEqualTo(3);
        assertThat(bundle.path("link")).hasSize(1);
        assertThat(bundle.at("/entry/0/resource/id").asText()).isEqualTo("c1");
        assertThat(bundle.at("/entry/1/resource/id").asText()).isEqualTo("c2");
        assertThat(bundle.at("/entry/2/resource/id").asText()).isEqualTo("p1");
    }

    @Test
    void fullBundle_dropsUnsupportedWhenAsked() {
        List<ProcessingOutcome> outcomes = List.of(
                ProcessingOutcome.processed(0, entry(condition("c1")), Set.of()),
                ProcessingOutcome.unsupported(1, entry(resource("Patient", "p1"))));

        ObjectNode bundle = assembler.assemble(bundle(), outcomes, OutputMode.FULL,
                UnsupportedRecordPolicy.DROP, 1L).bundle();

        assertThat(bundle.path("entry")).hasSize(1);
        assertThat(bundle.at("/extension/0/extension")).hasSize(3);
    }
}
