package com.fhirsls.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles topic sources into the rule table and publishes the result to the {@link RuleStore}.
 *
 * A request is either a single ValueSet or a Bundle of them. Within a bundle each source
 * is expanded, validated and flattened on its own; a rejected source leaves a diagnostic
 * and the rest still compile. The store is only touched when at least one source is valid.
 */
public class RuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    public static final int DEFAULT_MAX_MEMBER_DEPTH = 64;

    private static final List<String> INHERITED_FIELDS = List.of("id", "date", "topic", "useContext");

    private final RuleStore store;
    private final SourceExpander expander;
    private final TopicSourceReader reader;
    private final Clock clock;
    private final int maxMemberDepth;

    public RuleCompiler(RuleStore store, SourceExpander expander) {
        this(store, expander, Clock.systemUTC(), DEFAULT_MAX_MEMBER_DEPTH);
    }

    public RuleCompiler(RuleStore store, SourceExpander expander, Clock clock, int maxMemberDepth) {
        this.store = Objects.requireNonNull(store, "Rule store cannot be null");
        this.expander = Objects.requireNonNull(expander, "Expander cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.reader = new TopicSourceReader(maxMemberDepth);
        this.maxMemberDepth = maxMemberDepth;
    }

    /**
     * Compiles a FHIR ValueSet or Bundle of ValueSets.
     */
    public CompilationOutcome compile(JsonNode input) {
        if (input == null || !input.isObject()) {
            return CompilationOutcome.error("Invalid input: resourceType must be \"Bundle\" or \"ValueSet\"");
        }
        String resourceType = input.path(FhirTerms.RESOURCE_TYPE).asText("");
        if (FhirTerms.VALUE_SET.equals(resourceType)) {
            return compileSingle((ObjectNode) input);
        }
        if (FhirTerms.BUNDLE.equals(resourceType)) {
            return compileBundle(input);
        }
        return CompilationOutcome.error("Invalid input: resourceType must be \"Bundle\" or \"ValueSet\"");
    }

    /**
     * Compiles already-read sources. No expansion is attempted: a source without member
     * codes is rejected.
     */
    public CompilationOutcome compileSources(List<TopicSource> sources) {
        Objects.requireNonNull(sources, "Sources cannot be null");
        if (sources.isEmpty()) {
            return CompilationOutcome.warning("No sources supplied");
        }
        List<CompiledSource> valid = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        for (TopicSource source : sources) {
            List<String> errors = new ArrayList<>();
            CompiledSource compiled = toCompiled(source, errors);
            if (compiled != null) {
                valid.add(compiled);
            } else {
                diagnostics.addAll(errors);
            }
        }
        return publish(valid, diagnostics);
    }

    private CompilationOutcome compileSingle(ObjectNode valueSet) {
        String id = valueSet.path("id").asText("unknown");
        ObjectNode prepared = expandIfNeeded(valueSet);
        if (prepared == null) {
            return CompilationOutcome.error("Failed to expand ValueSet " + id);
        }

        List<String> errors = new ArrayList<>();
        CompiledSource compiled = readAndCompile(prepared, errors);
        if (compiled == null) {
            log.warn("Rejected ValueSet {}: {} validation error(s)", id, errors.size());
            return CompilationOutcome.error("Invalid ValueSet", errors);
        }
        return publish(List.of(compiled), List.of());
    }

    private CompilationOutcome compileBundle(JsonNode bundle) {
        JsonNode entries = bundle.path("entry");
        if (!entries.isArray() || entries.isEmpty()) {
            return CompilationOutcome.warning("Bundle contains no entries");
        }

        List<CompiledSource> valid = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        for (JsonNode entry : entries) {
            JsonNode resource = entry.path("resource");
            if (!resource.isObject() || !FhirTerms.VALUE_SET.equals(resource.path(FhirTerms.RESOURCE_TYPE).asText())) {
                diagnostics.add("Skipping non-ValueSet resource: "
                        + resource.path(FhirTerms.RESOURCE_TYPE).asText("unknown"));
                continue;
            }

            String id = resource.path("id").asText("unknown");
            ObjectNode prepared = expandIfNeeded((ObjectNode) resource);
            if (prepared == null) {
                diagnostics.add("Failed to expand ValueSet " + id);
                continue;
            }

            List<String> errors = new ArrayList<>();
            CompiledSource compiled = readAndCompile(prepared, errors);
            if (compiled == null) {
                log.warn("Rejected ValueSet {}: {} validation error(s)", id, errors.size());
                diagnostics.addAll(errors);
                continue;
            }
            valid.add(compiled);
        }

        return publish(valid, diagnostics);
    }

    private CompilationOutcome publish(List<CompiledSource> valid, List<String> diagnostics) {
        if (valid.isEmpty()) {
            return CompilationOutcome.error("No valid ValueSets found", diagnostics);
        }
        List<String> allDiagnostics = new ArrayList<>(diagnostics);
        List<CompiledSource> distinct = coalesceById(valid, allDiagnostics);
        RuleTable table = store.merge(distinct, clock.instant());
        log.info("Compiled {} source(s) into rule table v{} ({} rules, epoch {})",
                distinct.size(), table.version(), table.ruleCount(),
                table.effectiveEpoch().map(Object::toString).orElse("none"));
        return CompilationOutcome.success(distinct.size(), table.version(), allDiagnostics);
    }

    /**
     * Folds sources sharing an id within one request into a single source: topics and codes
     * are unioned and the earliest effective date wins.
     */
    static List<CompiledSource> coalesceById(List<CompiledSource> sources, List<String> diagnostics) {
        Map<String, CompiledSource> byId = new LinkedHashMap<>();
        for (CompiledSource source : sources) {
            CompiledSource previous = byId.get(source.id());
            if (previous == null) {
                byId.put(source.id(), source);
                continue;
            }
            String message = "ValueSet " + source.id() + " appears more than once; contributions merged";
            if (!diagnostics.contains(message)) {
                diagnostics.add(message);
                log.warn("ValueSet {} appears more than once in one request; merging contributions", source.id());
            }
            byId.put(source.id(), combine(previous, source));
        }
        return new ArrayList<>(byId.values());
    }

    private static CompiledSource combine(CompiledSource first, CompiledSource second) {
        Map<LabelKey, TopicLabel> topics = new LinkedHashMap<>();
        for (TopicLabel topic : first.topics()) {
            topics.putIfAbsent(topic.key(), topic);
        }
        for (TopicLabel topic : second.topics()) {
            topics.putIfAbsent(topic.key(), topic);
        }
        Set<CodeIdentity> codes = new LinkedHashSet<>(first.codes());
        codes.addAll(second.codes());
        return new CompiledSource(first.id(), new ArrayList<>(topics.values()), codes,
                earliest(first.effectiveDate(), second.effectiveDate()));
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    /**
     * Returns the ValueSet ready for reading: itself when it already has member codes,
     * otherwise the expansion with the original's identifying fields filled in. Returns
     * null when expansion fails.
     */
    private ObjectNode expandIfNeeded(ObjectNode valueSet) {
        if (valueSet.path("expansion").path("contains").isArray()) {
            return valueSet;
        }

        String id = valueSet.path("id").asText("unknown");
        ExpansionResult result;
        try {
            result = expander.expand(valueSet);
        } catch (RuntimeException e) {
            log.warn("Expansion of ValueSet {} failed: {}", id, e.getMessage());
            return null;
        }
        if (result == null || !result.success() || result.valueSet() == null || !result.valueSet().isObject()) {
            log.warn("Expansion of ValueSet {} failed: {}", id,
                    result != null && result.failureReason() != null ? result.failureReason() : "no result");
            return null;
        }

        ObjectNode expanded = ((ObjectNode) result.valueSet()).deepCopy();
        for (String field : INHERITED_FIELDS) {
            if (!expanded.hasNonNull(field) && valueSet.hasNonNull(field)) {
                expanded.set(field, valueSet.get(field).deepCopy());
            }
        }
        log.debug("Expanded ValueSet {}", id);
        return expanded;
    }

    private CompiledSource readAndCompile(ObjectNode valueSet, List<String> errors) {
        TopicSourceReader.ReadResult read = reader.read(valueSet);
        if (!read.isValid()) {
            errors.addAll(read.errors());
            return null;
        }
        return toCompiled(read.source(), errors);
    }

    private CompiledSource toCompiled(TopicSource source, List<String> errors) {
        if (source.topics().isEmpty()) {
            errors.add("ValueSet " + source.id()
                    + " missing topic: must have either topic[0].coding[0] or useContext with code=focus");
            return null;
        }
        Set<CodeIdentity> codes;
        try {
            codes = flatten(source.members(), maxMemberDepth);
        } catch (MemberTreeTooDeepException e) {
            errors.add("ValueSet " + source.id() + " " + e.getMessage());
            return null;
        }
        if (codes.isEmpty()) {
            errors.add("ValueSet " + source.id() + " expansion.contains has no member codes");
            return null;
        }
        return new CompiledSource(source.id(), source.topics(), codes, source.effectiveDate().orElse(null));
    }

    /**
     * Flattens a member tree depth-first into the distinct coded members, in encounter order.
     *
     * @throws MemberTreeTooDeepException when the tree nests beyond {@code maxDepth}
     */
    public static Set<CodeIdentity> flatten(List<MemberCode> members, int maxDepth) {
        Set<CodeIdentity> codes = new LinkedHashSet<>();
        collect(members, 1, maxDepth, codes);
        return codes;
    }

    private static void collect(List<MemberCode> members, int depth, int maxDepth, Set<CodeIdentity> codes) {
        if (depth > maxDepth) {
            throw new MemberTreeTooDeepException(maxDepth);
        }
        for (MemberCode member : members) {
            if (member.isCoded()) {
                codes.add(member.identity());
            }
            if (!member.contains().isEmpty()) {
                collect(member.contains(), depth + 1, maxDepth, codes);
            }
        }
    }
}
