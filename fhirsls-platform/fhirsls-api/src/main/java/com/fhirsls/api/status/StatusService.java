package com.fhirsls.api.status;

import com.fhirsls.core.rules.CodeIdentity;
import com.fhirsls.core.rules.CompiledSource;
import com.fhirsls.core.rules.LabelKey;
import com.fhirsls.core.rules.RuleStore;
import com.fhirsls.core.rules.RuleTable;
import com.fhirsls.core.rules.TopicLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports what is loaded and clears it.
 */
@Service
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    private final RuleStore ruleStore;
    private final ProcessingStatistics statistics;

    public StatusService(RuleStore ruleStore, ProcessingStatistics statistics) {
        this.ruleStore = ruleStore;
        this.statistics = statistics;
    }

    public StatusDto getStatus() {
        RuleTable table = ruleStore.current().orElse(RuleTable.empty());

        List<ValueSetSummary> valueSets = table.sources().stream()
                .map(s -> new ValueSetSummary(s.id(), format(s.effectiveDate()), s.codes().size()))
                .toList();

        return new StatusDto(
                valueSets,
                table.ruleCount(),
                rulesByTopic(table),
                format(table.effectiveEpoch().orElse(null)),
                table.version(),
                format(table.compiledAt().orElse(null)),
                statistics.snapshot()
        );
    }

    public void clearAll() {
        ruleStore.clear();
        statistics.reset();
        log.info("Cleared rule table and statistics");
    }

    private static List<TopicSummary> rulesByTopic(RuleTable table) {
        Map<LabelKey, TopicLabel> topics = new LinkedHashMap<>();
        Map<LabelKey, Set<CodeIdentity>> codes = new LinkedHashMap<>();
        for (CompiledSource source : table.sources()) {
            for (TopicLabel topic : source.topics()) {
                topics.putIfAbsent(topic.key(), topic);
                codes.computeIfAbsent(topic.key(), k -> new HashSet<>()).addAll(source.codes());
            }
        }
        return topics.values().stream()
                .map(t -> new TopicSummary(t.system(), t.code(), t.display(), codes.get(t.key()).size()))
                .toList();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    // ==================== DTOs ====================

    public record StatusDto(
            List<ValueSetSummary> valueSets,
            int rulesCount,
            List<TopicSummary> rulesByTopic,
            String earliestDate,
            long tableVersion,
            String compiledAt,
            ProcessingStatistics.Snapshot stats
    ) {}

    public record ValueSetSummary(String id, String date, int codeCount) {}

    public record TopicSummary(String system, String code, String display, int codeCount) {}
}
