package com.fhirsls.api.status;

import com.fhirsls.core.tagging.ProcessingCounters;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cumulative in-memory counters since start or the last data clear.
 */
@Component
public class ProcessingStatistics {

    private final AtomicLong totalValueSetsProcessed = new AtomicLong();
    private final AtomicLong totalResourcesAnalyzed = new AtomicLong();
    private final AtomicLong totalResourcesLabeled = new AtomicLong();
    private final AtomicLong totalResourcesSkipped = new AtomicLong();
    private final AtomicReference<Instant> lastProcessed = new AtomicReference<>();

    public void recordCompilation(int sourcesCompiled, Instant at) {
        totalValueSetsProcessed.addAndGet(sourcesCompiled);
        lastProcessed.set(at);
    }

    public void recordBatch(ProcessingCounters counters, Instant at) {
        totalResourcesAnalyzed.addAndGet(counters.analyzed());
        totalResourcesLabeled.addAndGet(counters.labeled());
        totalResourcesSkipped.addAndGet(counters.skipped());
        lastProcessed.set(at);
    }

    public void reset() {
        totalValueSetsProcessed.set(0);
        totalResourcesAnalyzed.set(0);
        totalResourcesLabeled.set(0);
        totalResourcesSkipped.set(0);
        lastProcessed.set(null);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                totalValueSetsProcessed.get(),
                totalResourcesAnalyzed.get(),
                totalResourcesLabeled.get(),
                totalResourcesSkipped.get(),
                lastProcessed.get()
        );
    }

    public record Snapshot(
            long totalValueSetsProcessed,
            long totalResourcesAnalyzed,
            long totalResourcesLabeled,
            long totalResourcesSkipped,
            Instant lastProcessed
    ) {}
}
