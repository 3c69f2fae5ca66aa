package com.fhirsls.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhirsls.api.expansion.TxServerExpander;
import com.fhirsls.core.rules.RuleCompiler;
import com.fhirsls.core.rules.RuleStore;
import com.fhirsls.core.rules.SourceExpander;
import com.fhirsls.core.tagging.TaggingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the labeling engine. One rule store is shared by compilation and tagging.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleStore ruleStore() {
        return new RuleStore();
    }

    @Bean
    public SourceExpander sourceExpander(
            ObjectMapper objectMapper,
            @Value("${fhirsls.expansion.enabled:true}") boolean enabled,
            @Value("${fhirsls.expansion.base-url:https://tx.fhir.org/r4}") String baseUrl,
            @Value("${fhirsls.expansion.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${fhirsls.expansion.request-timeout-seconds:30}") long requestTimeoutSeconds) {
        if (!enabled) {
            log.info("ValueSet expansion disabled; unexpanded ValueSets will be rejected");
            return SourceExpander.unavailable();
        }
        log.info("ValueSet expansion via {}", baseUrl);
        return new TxServerExpander(baseUrl, objectMapper,
                Duration.ofSeconds(connectTimeoutSeconds), Duration.ofSeconds(requestTimeoutSeconds));
    }

    @Bean
    public RuleCompiler ruleCompiler(RuleStore store, SourceExpander expander, Clock clock, SlsProperties properties) {
        return new RuleCompiler(store, expander, clock, properties.getMaxMemberDepth());
    }

    @Bean
    public TaggingEngine taggingEngine(RuleStore store, Clock clock, SlsProperties properties) {
        return new TaggingEngine(store, properties.toTaggingOptions(), clock);
    }
}
