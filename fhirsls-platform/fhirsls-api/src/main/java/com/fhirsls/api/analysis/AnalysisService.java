package com.fhirsls.api.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.api.status.ProcessingStatistics;
import com.fhirsls.core.tagging.OutputMode;
import com.fhirsls.core.tagging.TaggingEngine;
import com.fhirsls.core.tagging.TaggingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Tags clinical record bundles against the current rule table.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final TaggingEngine taggingEngine;
    private final ProcessingStatistics statistics;
    private final Clock clock;

    public AnalysisService(TaggingEngine taggingEngine, ProcessingStatistics statistics, Clock clock) {
        this.taggingEngine = taggingEngine;
        this.statistics = statistics;
        this.clock = clock;
    }

    public TaggingResult analyze(JsonNode bundle, OutputMode mode) {
        TaggingResult result = taggingEngine.tag(bundle, mode);
        statistics.recordBatch(result.counters(), clock.instant());
        log.debug("Analyzed {} bundle against rules v{}", mode, result.tableVersion());
        return result;
    }
}
