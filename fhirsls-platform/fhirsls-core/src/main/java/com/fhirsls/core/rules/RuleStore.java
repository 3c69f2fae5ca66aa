package com.fhirsls.core.rules;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the current rule table. Readers bind to one snapshot for the whole of a request;
 * writers publish a new snapshot with a single atomic swap.
 */
public class RuleStore {

    private final AtomicReference<RuleTable> current = new AtomicReference<>();

    /**
     * The published table, or empty when no rules have been compiled since start or the last clear.
     */
    public Optional<RuleTable> current() {
        return Optional.ofNullable(current.get());
    }

    public RuleTable merge(Collection<CompiledSource> sources, Instant now) {
        return current.updateAndGet(prior ->
                (prior != null ? prior : RuleTable.empty()).merge(sources, now));
    }

    public void clear() {
        current.set(null);
    }
}
