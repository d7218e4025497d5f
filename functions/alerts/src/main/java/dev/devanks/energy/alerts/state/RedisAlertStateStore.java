package dev.devanks.energy.alerts.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * State shared by every worker instance. Trigger times are stored as epoch millis; arming is a
 * compare-and-set executed atomically on the server.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisAlertStateStore implements AlertStateStore {

    // ARGV[1] is the expected value, empty when the key must not exist yet.
    static final RedisScript<Boolean> COMPARE_AND_SET = RedisScript.of(
            "local current = redis.call('GET', KEYS[1]) "
                    + "if (current == false and ARGV[1] == '') or current == ARGV[1] then "
                    + "redis.call('SET', KEYS[1], ARGV[2]) "
                    + "return 1 "
                    + "end "
                    + "return 0", Boolean.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration operationTimeout;

    @Override
    public Mono<Instant> lastTriggered(String ruleId) {
        return redisTemplate.opsForValue().get(key(ruleId))
                .timeout(operationTimeout)
                .map(epochMillis -> Instant.ofEpochMilli(Long.parseLong(epochMillis)));
    }

    @Override
    public Mono<Boolean> compareAndSet(String ruleId, Instant expected, Instant next) {
        String expectedArg = expected == null ? "" : String.valueOf(expected.toEpochMilli());
        String nextArg = String.valueOf(next.toEpochMilli());
        return redisTemplate.execute(COMPARE_AND_SET, List.of(key(ruleId)), List.of(expectedArg, nextArg))
                .next()
                .timeout(operationTimeout)
                .defaultIfEmpty(false)
                .doOnNext(armed -> {
                    if (!armed) {
                        log.info("Rule {} was armed by another worker since {}", ruleId, expected);
                    }
                });
    }

    String key(String ruleId) {
        return keyPrefix + ruleId;
    }
}
