package dev.devanks.energy.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.energy.analytics.cache.AggregateCache;
import dev.devanks.energy.analytics.cache.CacheTtlPolicy;
import dev.devanks.energy.analytics.cache.LocalAggregateCache;
import dev.devanks.energy.analytics.cache.NoOpAggregateCache;
import dev.devanks.energy.analytics.cache.RedisAggregateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;
import java.util.Random;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class CacheConfig {

    private final AnalyticsProperties analyticsProperties;

    @Bean
    public AggregateCache aggregateCache(Clock clock,
                                         ObjectMapper objectMapper,
                                         CacheTtlPolicy cacheTtlPolicy,
                                         ObjectProvider<ReactiveStringRedisTemplate> redisTemplateProvider) {
        var cacheProperties = analyticsProperties.getCache();
        switch (cacheProperties.getBackend()) {
            case LOCAL:
                log.info("Using in-process aggregate cache (max {} entries).", cacheProperties.getLocalMaxEntries());
                return new LocalAggregateCache(clock, cacheProperties.getLocalMaxEntries(), cacheTtlPolicy.maxTtl());
            case REDIS:
                log.info("Using Redis aggregate cache (operation timeout {}).", cacheProperties.getOperationTimeout());
                return new RedisAggregateCache(redisTemplateProvider.getObject(), objectMapper,
                        cacheProperties.getOperationTimeout());
            case NONE:
            default:
                log.warn("No aggregate cache configured, every query reads the rollup store.");
                return new NoOpAggregateCache();
        }
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy() {
        var cacheProperties = analyticsProperties.getCache();
        return new CacheTtlPolicy(cacheProperties.getBaseTtl(), cacheProperties.getJitterMax(), new Random());
    }
}
