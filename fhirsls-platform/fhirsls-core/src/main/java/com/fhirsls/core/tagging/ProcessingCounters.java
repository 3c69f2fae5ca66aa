package com.fhirsls.core.tagging;

import java.util.Collection;

/**
 * Per-batch counts. Unsupported records count toward none of analyzed, labeled or skipped.
 */
public record ProcessingCounters(
        int analyzed,
        int labeled,
        int skipped,
        int unsupported
) {

    public static ProcessingCounters of(Collection<ProcessingOutcome> outcomes) {
        int analyzed = 0;
        int labeled = 0;
        int skipped = 0;
        int unsupported = 0;
        for (ProcessingOutcome outcome : outcomes) {
            switch (outcome.disposition()) {
                case PROCESSED -> {
                    analyzed++;
                    if (outcome.isLabeled()) {
                        labeled++;
                    }
                }
                case SKIPPED -> skipped++;
                case UNSUPPORTED -> unsupported++;
            }
        }
        return new ProcessingCounters(analyzed, labeled, skipped, unsupported);
    }
}
