package dev.devanks.energy.analytics.cache;

import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.analytics.model.Step;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class LocalAggregateCacheTest {

    @Mock
    private Clock mockClock;

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2025-07-30T00:00:00Z"));

    private static final Duration MAX_TTL = Duration.ofMinutes(10);
    private static final CacheKey KEY = key("h1");
    private static final CachedValue VALUE = new CachedValue("[{\"t\":\"2025-07-29T00:00:00Z\",\"v\":12.5}]",
            Instant.parse("2025-07-30T00:00:00Z"));

    private static CacheKey key(String scopeId) {
        return CacheKey.builder()
                .metric("energy_wh_sum")
                .scope(Scope.HOUSEHOLD)
                .scopeId(scopeId)
                .start(Instant.parse("2025-07-29T00:00:00Z"))
                .end(Instant.parse("2025-07-30T00:00:00Z"))
                .step(Step.FIVE_MINUTES)
                .build();
    }

    @BeforeEach
    void setUp() {
        lenient().when(mockClock.instant()).thenAnswer(invocation -> now.get());
    }

    private void advance(Duration duration) {
        now.updateAndGet(instant -> instant.plus(duration));
    }

    @Test
    @DisplayName("get - Value written with a 60s TTL is returned unchanged one second later")
    void get_withinTtl_returnsValue() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 100, MAX_TTL);

        StepVerifier.create(cache.set(KEY, VALUE, Duration.ofSeconds(60))).verifyComplete();
        advance(Duration.ofSeconds(1));

        StepVerifier.create(cache.get(KEY))
                .expectNext(VALUE)
                .verifyComplete();
    }

    @Test
    @DisplayName("get - Entry is gone once its TTL has elapsed")
    void get_afterTtl_misses() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 100, MAX_TTL);
        cache.set(KEY, VALUE, Duration.ofSeconds(72)).block();

        advance(Duration.ofSeconds(72));

        StepVerifier.create(cache.get(KEY)).verifyComplete();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("get - Unknown key is a miss")
    void get_unknownKey_misses() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 100, MAX_TTL);

        StepVerifier.create(cache.get(KEY)).verifyComplete();
    }

    @Test
    @DisplayName("set - Full cache evicts the oldest write")
    void set_full_evictsOldest() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 2, MAX_TTL);
        cache.set(key("a"), VALUE, Duration.ofMinutes(5)).block();
        advance(Duration.ofSeconds(1));
        cache.set(key("b"), VALUE, Duration.ofMinutes(5)).block();
        advance(Duration.ofSeconds(1));

        cache.set(key("c"), VALUE, Duration.ofMinutes(5)).block();

        assertThat(cache.size()).isEqualTo(2);
        StepVerifier.create(cache.get(key("a"))).verifyComplete();
        StepVerifier.create(cache.get(key("b"))).expectNext(VALUE).verifyComplete();
        StepVerifier.create(cache.get(key("c"))).expectNext(VALUE).verifyComplete();
    }

    @Test
    @DisplayName("set - Overwriting a key in a full cache evicts nothing")
    void set_overwrite_keepsOthers() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 2, MAX_TTL);
        cache.set(key("a"), VALUE, Duration.ofMinutes(5)).block();
        cache.set(key("b"), VALUE, Duration.ofMinutes(5)).block();

        CachedValue newer = new CachedValue("[]", now.get());
        cache.set(key("a"), newer, Duration.ofMinutes(5)).block();

        StepVerifier.create(cache.get(key("a"))).expectNext(newer).verifyComplete();
        StepVerifier.create(cache.get(key("b"))).expectNext(VALUE).verifyComplete();
    }

    @Test
    @DisplayName("get - Jittered TTL shorter than the cache-wide limit still expires on time")
    void get_perEntryTtl_beforeCacheLimit() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 100, MAX_TTL);
        cache.set(key("short"), VALUE, Duration.ofSeconds(61)).block();
        cache.set(key("long"), VALUE, Duration.ofSeconds(71)).block();

        advance(Duration.ofSeconds(65));

        StepVerifier.create(cache.get(key("short"))).verifyComplete();
        StepVerifier.create(cache.get(key("long"))).expectNext(VALUE).verifyComplete();
    }

    @Test
    @DisplayName("get - Nothing outlives the cache-wide TTL limit")
    void get_beyondMaxTtl_misses() {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 100, Duration.ofSeconds(72));
        cache.set(KEY, VALUE, Duration.ofHours(1)).block();

        advance(Duration.ofSeconds(72));

        StepVerifier.create(cache.get(KEY)).verifyComplete();
    }

    @Test
    @DisplayName("set - Concurrent writers never push the cache past its size limit")
    void set_concurrentWriters_stayBounded() throws Exception {
        LocalAggregateCache cache = new LocalAggregateCache(mockClock, 50, MAX_TTL);
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<?>> writes = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String prefix = "w" + w + "-";
                writes.add(executor.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < 500; i++) {
                        cache.set(key(prefix + i), VALUE, Duration.ofMinutes(5)).block();
                        cache.get(key(prefix + (i / 2))).block();
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> write : writes) {
                write.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isLessThanOrEqualTo(50);
        cache.set(KEY, VALUE, Duration.ofMinutes(5)).block();
        StepVerifier.create(cache.get(KEY)).expectNext(VALUE).verifyComplete();
    }
}
