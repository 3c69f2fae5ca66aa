package com.fhirsls.core.tagging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirTerms;
import com.fhirsls.core.rules.RuleStore;
import com.fhirsls.core.rules.RuleTable;
import com.fhirsls.core.rules.TopicLabel;
import com.fhirsls.core.scan.CodeScanner;
import com.fhirsls.core.scan.ScanDepthExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Runs a bundle of clinical records through gate, scan and label, then assembles the output.
 *
 * The rule table is bound once at the start of a request, so a compilation published
 * mid-request is not observed. Each entry is worked on as a private deep copy, which makes
 * entries independent of each other and lets them be processed in parallel; the caller's
 * bundle is never modified.
 */
public class TaggingEngine {

    private static final Logger log = LoggerFactory.getLogger(TaggingEngine.class);

    private final RuleStore store;
    private final TaggingOptions options;
    private final SyncGate gate;
    private final CodeScanner scanner;
    private final LabelApplier applier;
    private final BundleAssembler assembler;

    public TaggingEngine(RuleStore store) {
        this(store, TaggingOptions.defaults(), Clock.systemUTC());
    }

    public TaggingEngine(RuleStore store, TaggingOptions options, Clock clock) {
        this.store = Objects.requireNonNull(store, "Rule store cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        Objects.requireNonNull(clock, "Clock cannot be null");
        this.gate = new SyncGate();
        this.scanner = new CodeScanner(options.maxScanDepth());
        this.applier = new LabelApplier(clock);
        this.assembler = new BundleAssembler(clock);
    }

    /**
     * Tags every supported record in the bundle.
     *
     * @throws InvalidBundleException  when the input is not a non-empty Bundle or a record is too deep to scan
     * @throws RulesNotLoadedException when no rule table has been published
     */
    public TaggingResult tag(JsonNode bundle, OutputMode mode) {
        Objects.requireNonNull(mode, "Output mode cannot be null");
        if (bundle == null || !FhirTerms.BUNDLE.equals(bundle.path(FhirTerms.RESOURCE_TYPE).asText())) {
            throw new InvalidBundleException("Invalid Bundle: resourceType must be \"Bundle\"");
        }
        JsonNode entries = bundle.path("entry");
        if (!entries.isArray() || entries.isEmpty()) {
            throw new InvalidBundleException("Bundle contains no entries");
        }
        RuleTable table = store.current().orElseThrow(RulesNotLoadedException::new);
        Optional<Instant> epoch = table.effectiveEpoch();

        IntStream indices = IntStream.range(0, entries.size());
        if (options.parallel()) {
            indices = indices.parallel();
        }

        List<ProcessingOutcome> outcomes;
        try {
            outcomes = indices.mapToObj(i -> process(i, entries.get(i), table, epoch)).toList();
        } catch (ScanDepthExceededException e) {
            log.warn("Rejected bundle: {}", e.getMessage());
            throw new InvalidBundleException(e.getMessage(), e);
        }

        TaggingResult result = assembler.assemble(bundle, outcomes, mode, options.unsupportedPolicy(), table.version());
        ProcessingCounters counters = result.counters();
        log.info("Tagged bundle ({} mode, rules v{}): analyzed={}, labeled={}, skipped={}, unsupported={}",
                mode, table.version(), counters.analyzed(), counters.labeled(),
                counters.skipped(), counters.unsupported());
        return result;
    }

    private ProcessingOutcome process(int index, JsonNode entry, RuleTable table, Optional<Instant> epoch) {
        JsonNode copy = entry.deepCopy();
        JsonNode resource = copy.path("resource");
        if (!(resource instanceof ObjectNode record) || !isSupported(record)) {
            return ProcessingOutcome.unsupported(index, copy);
        }
        if (gate.shouldSkip(record, epoch)) {
            log.debug("Entry {} is current, skipping", index);
            return ProcessingOutcome.skipped(index, copy);
        }

        Set<TopicLabel> matched = scanner.scan(record, table);
        List<TopicLabel> added = applier.apply(record, matched);
        log.debug("Entry {} matched {} topic(s), added {} label(s)", index, matched.size(), added.size());
        return ProcessingOutcome.processed(index, copy, matched);
    }

    private boolean isSupported(ObjectNode record) {
        return options.supportedResourceTypes().contains(record.path(FhirTerms.RESOURCE_TYPE).asText());
    }
}
