package dev.devanks.energy.analytics.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Cache shared by all instances. Values are stored as JSON with a native Redis TTL. Every
 * operation is bounded by {@code operationTimeout}; errors and timeouts read as a miss.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisAggregateCache implements AggregateCache {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration operationTimeout;

    @Override
    public Mono<CachedValue> get(CacheKey key) {
        String redisKey = key.render();
        return redisTemplate.opsForValue().get(redisKey)
                .timeout(operationTimeout)
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, CachedValue.class)))
                .onErrorResume(e -> {
                    log.warn("Redis cache read failed for {}, treating as miss: {}", redisKey, e.toString());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> set(CacheKey key, CachedValue value, Duration ttl) {
        String redisKey = key.render();
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
                .flatMap(json -> redisTemplate.opsForValue().set(redisKey, json, ttl))
                .timeout(operationTimeout)
                .doOnNext(stored -> {
                    if (!Boolean.TRUE.equals(stored)) {
                        log.warn("Redis did not store cache entry {}", redisKey);
                    }
                })
                .then()
                .onErrorResume(e -> {
                    log.warn("Redis cache write failed for {}, continuing without cache: {}", redisKey, e.toString());
                    return Mono.empty();
                });
    }
}
