package dev.devanks.energy.aggregates.config;

import dev.devanks.energy.aggregates.model.Granularity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AggregatesConfig {

    private final RollupPolicyProperties rollupPolicyProperties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @PostConstruct
    void logPolicies() {
        for (Granularity granularity : Granularity.values()) {
            var policy = rollupPolicyProperties.policyFor(granularity);
            log.info("Rollup policy {} ({}): schedule={} startOffset={} endOffset={} stalenessBound={}",
                    granularity, granularity.collectionName(), policy.getScheduleInterval(),
                    policy.getStartOffset(), policy.getEndOffset(), policy.stalenessBound());
        }
        log.info("Raw reading chunk interval: {}", rollupPolicyProperties.getChunkInterval());
    }
}
