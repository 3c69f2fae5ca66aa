package com.fhirsls.core.rules;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the compiled rules: which topics each code triggers, and the
 * effective epoch records must have been processed after to count as current.
 *
 * Each source contributes under its ID, so re-compiling a source replaces what it
 * contributed before. The epoch is carried forward across merges and only ever moves
 * earlier.
 */
public final class RuleTable {

    private static final RuleTable EMPTY = new RuleTable(0L, Map.of(), Map.of(), null, null);

    private final long version;
    private final Map<String, CompiledSource> sources;
    private final Map<CodeIdentity, Set<TopicLabel>> index;
    private final Instant effectiveEpoch;
    private final Instant compiledAt;

    private RuleTable(long version,
                      Map<String, CompiledSource> sources,
                      Map<CodeIdentity, Set<TopicLabel>> index,
                      Instant effectiveEpoch,
                      Instant compiledAt) {
        this.version = version;
        this.sources = sources;
        this.index = index;
        this.effectiveEpoch = effectiveEpoch;
        this.compiledAt = compiledAt;
    }

    public static RuleTable empty() {
        return EMPTY;
    }

    /**
     * Returns a new table with the given sources merged in. This table is left untouched.
     */
    public RuleTable merge(Collection<CompiledSource> incoming, Instant now) {
        Objects.requireNonNull(incoming, "Incoming sources cannot be null");
        Objects.requireNonNull(now, "Compilation time cannot be null");

        Map<String, CompiledSource> merged = new LinkedHashMap<>(sources);
        Instant epoch = effectiveEpoch;
        for (CompiledSource source : incoming) {
            merged.put(source.id(), source);
            Instant date = source.effectiveDate();
            if (date != null && (epoch == null || date.isBefore(epoch))) {
                epoch = date;
            }
        }

        return new RuleTable(
                version + 1,
                Collections.unmodifiableMap(merged),
                buildIndex(merged.values()),
                epoch,
                now
        );
    }

    private static Map<CodeIdentity, Set<TopicLabel>> buildIndex(Collection<CompiledSource> sources) {
        Map<CodeIdentity, Map<LabelKey, TopicLabel>> working = new LinkedHashMap<>();
        for (CompiledSource source : sources) {
            for (CodeIdentity code : source.codes()) {
                Map<LabelKey, TopicLabel> topics = working.computeIfAbsent(code, k -> new LinkedHashMap<>());
                for (TopicLabel topic : source.topics()) {
                    topics.putIfAbsent(topic.key(), topic);
                }
            }
        }

        Map<CodeIdentity, Set<TopicLabel>> frozen = new LinkedHashMap<>(working.size() * 2);
        working.forEach((code, topics) ->
                frozen.put(code, Collections.unmodifiableSet(new LinkedHashSet<>(topics.values()))));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Topics triggered by a code, or an empty set when the code is not a rule.
     */
    public Set<TopicLabel> lookup(CodeIdentity code) {
        return index.getOrDefault(code, Set.of());
    }

    public boolean contains(CodeIdentity code) {
        return index.containsKey(code);
    }

    public Optional<Instant> effectiveEpoch() {
        return Optional.ofNullable(effectiveEpoch);
    }

    public long version() {
        return version;
    }

    public Optional<Instant> compiledAt() {
        return Optional.ofNullable(compiledAt);
    }

    public List<CompiledSource> sources() {
        return List.copyOf(sources.values());
    }

    public Optional<CompiledSource> source(String id) {
        return Optional.ofNullable(sources.get(id));
    }

    /**
     * Number of distinct (code, topic) associations.
     */
    public int ruleCount() {
        return index.values().stream().mapToInt(Set::size).sum();
    }

    public int codeCount() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleTable{version=" + version + ", sources=" + sources.size()
                + ", rules=" + ruleCount() + ", epoch=" + effectiveEpoch + "}";
    }
}
