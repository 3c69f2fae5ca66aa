package com.fhirsls.api.valueset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.api.status.ProcessingStatistics;
import com.fhirsls.core.rules.CompilationOutcome;
import com.fhirsls.core.rules.RuleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Loads sensitive-topic ValueSets into the rule table.
 */
@Service
public class ValueSetService {

    private static final Logger log = LoggerFactory.getLogger(ValueSetService.class);

    private final RuleCompiler ruleCompiler;
    private final ProcessingStatistics statistics;
    private final Clock clock;

    public ValueSetService(RuleCompiler ruleCompiler, ProcessingStatistics statistics, Clock clock) {
        this.ruleCompiler = ruleCompiler;
        this.statistics = statistics;
        this.clock = clock;
    }

    public CompilationOutcome load(JsonNode valueSets) {
        CompilationOutcome outcome = ruleCompiler.compile(valueSets);
        if (outcome.isError()) {
            log.warn("ValueSet load rejected: {} ({} diagnostic(s))", outcome.message(), outcome.diagnostics().size());
        } else if (outcome.sourcesCompiled() > 0) {
            statistics.recordCompilation(outcome.sourcesCompiled(), clock.instant());
        }
        return outcome;
    }
}
