package dev.devanks.energy.alerts.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisAlertStateStoreTest {

    @Mock
    private ReactiveStringRedisTemplate mockRedisTemplate;
    @Mock
    private ReactiveValueOperations<String, String> mockValueOperations;

    private RedisAlertStateStore store;

    private static final Instant T0 = Instant.parse("2025-07-30T12:00:00Z");

    @BeforeEach
    void setUp() {
        store = new RedisAlertStateStore(mockRedisTemplate, "alerts:last-triggered:", Duration.ofMillis(200));
    }

    @Test
    @DisplayName("lastTriggered - Epoch millis are read back as an instant")
    void lastTriggered_present() {
        when(mockRedisTemplate.opsForValue()).thenReturn(mockValueOperations);
        when(mockValueOperations.get("alerts:last-triggered:r1")).thenReturn(Mono.just(String.valueOf(T0.toEpochMilli())));

        StepVerifier.create(store.lastTriggered("r1")).expectNext(T0).verifyComplete();
    }

    @Test
    @DisplayName("lastTriggered - Missing key means never triggered")
    void lastTriggered_absent() {
        when(mockRedisTemplate.opsForValue()).thenReturn(mockValueOperations);
        when(mockValueOperations.get("alerts:last-triggered:r1")).thenReturn(Mono.empty());

        StepVerifier.create(store.lastTriggered("r1")).verifyComplete();
    }

    @Test
    @DisplayName("compareAndSet - First arm passes an empty expected value")
    void compareAndSet_firstArm() {
        when(mockRedisTemplate.execute(RedisAlertStateStore.COMPARE_AND_SET,
                List.of("alerts:last-triggered:r1"), List.of("", String.valueOf(T0.toEpochMilli()))))
                .thenReturn(Flux.just(true));

        StepVerifier.create(store.compareAndSet("r1", null, T0)).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("compareAndSet - Lost race reports false")
    void compareAndSet_lost() {
        Instant previous = T0.minusSeconds(600);
        when(mockRedisTemplate.execute(RedisAlertStateStore.COMPARE_AND_SET,
                List.of("alerts:last-triggered:r1"),
                List.of(String.valueOf(previous.toEpochMilli()), String.valueOf(T0.toEpochMilli()))))
                .thenReturn(Flux.just(false));

        StepVerifier.create(store.compareAndSet("r1", previous, T0)).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("compareAndSet - Redis failure propagates so the rule is not fired unguarded")
    void compareAndSet_failure() {
        when(mockRedisTemplate.execute(RedisAlertStateStore.COMPARE_AND_SET,
                List.of("alerts:last-triggered:r1"), List.of("", String.valueOf(T0.toEpochMilli()))))
                .thenReturn(Flux.error(new RedisConnectionFailureException("Connection refused")));

        StepVerifier.create(store.compareAndSet("r1", null, T0))
                .expectError(RedisConnectionFailureException.class)
                .verify();
    }
}
