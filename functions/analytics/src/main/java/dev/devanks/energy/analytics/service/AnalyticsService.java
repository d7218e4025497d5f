package dev.devanks.energy.analytics.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.aggregates.model.AggregateBucket;
import dev.devanks.energy.aggregates.model.Granularity;
import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.aggregates.service.AggregateStoreService;
import dev.devanks.energy.analytics.cache.AggregateCache;
import dev.devanks.energy.analytics.cache.CacheKey;
import dev.devanks.energy.analytics.cache.CacheTtlPolicy;
import dev.devanks.energy.analytics.cache.CachedValue;
import dev.devanks.energy.analytics.config.AnalyticsProperties;
import dev.devanks.energy.analytics.exception.InvalidQueryException;
import dev.devanks.energy.analytics.model.DeviceEnergy;
import dev.devanks.energy.analytics.model.EnergySeries;
import dev.devanks.energy.analytics.model.RangePreset;
import dev.devanks.energy.analytics.model.SeriesPoint;
import dev.devanks.energy.analytics.model.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Serves energy series and device rankings from the rollups. Series are cache-first; rankings always
 * read the device-hour rollup. Neither operation waits for or triggers a rollup refresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsService {

    static final String ENERGY_METRIC = "energy_wh_sum";
    private static final TypeReference<List<SeriesPoint>> SERIES_TYPE = new TypeReference<>() {
    };
    private static final double WH_PER_KWH = 1000.0;

    private final AggregateStoreService aggregateStoreService;
    private final AggregateCache aggregateCache;
    private final CacheTtlPolicy cacheTtlPolicy;
    private final AnalyticsProperties analyticsProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Energy per step over {@code [start, end)}.
     *
     * @return the series with its read time; an empty series when there is no data.
     * @throws InvalidQueryException (as error signal) for an empty range or a step the scope does not support.
     */
    public Mono<EnergySeries> energyByScope(Scope scope, String scopeId, Instant start, Instant end, Step step) {
        return Mono.defer(() -> {
            validateRange(start, end);
            Granularity source = sourceGranularity(scope, step);
            CacheKey key = CacheKey.builder()
                    .metric(ENERGY_METRIC)
                    .scope(scope)
                    .scopeId(scopeId)
                    .start(start)
                    .end(end)
                    .step(step)
                    .build();

            return aggregateCache.get(key)
                    .flatMap(cached -> fromCache(key, cached))
                    .switchIfEmpty(Mono.defer(() -> readThrough(key, source)));
        });
    }

    /**
     * Energy per step over a trailing preset range ending with the current step.
     */
    public Mono<EnergySeries> energyByPreset(Scope scope, String scopeId, RangePreset preset, Step step) {
        return Mono.defer(() -> {
            if (!preset.allows(step)) {
                return Mono.error(new InvalidQueryException("Range " + preset.wireName()
                        + " needs a step of at least " + preset.minimumStep().wireName() + ", got " + step.wireName()));
            }
            // Aligned so every call within the same step shares a cache entry.
            Instant end = step.alignDown(clock.instant()).plus(step.width());
            Instant start = end.minus(preset.length());
            return energyByScope(scope, scopeId, start, end, step);
        });
    }

    /**
     * Devices of a household ranked by energy over the trailing window.
     *
     * @param window trailing window, defaults to {@code analytics.top-devices.default-window} when null;
     *               longer than {@code analytics.top-devices.max-window} is rejected.
     * @param limit  number of devices, defaults to {@code analytics.top-devices.default-limit} when null;
     *               capped at {@code analytics.top-devices.max-limit}.
     * @return devices by energy descending, device id ascending on ties; devices without positive energy are left out.
     */
    public Mono<List<DeviceEnergy>> topDevices(String householdId, Duration window, Integer limit) {
        return Mono.defer(() -> {
            var topDevicesProperties = analyticsProperties.getTopDevices();
            Duration effectiveWindow = window != null ? window : topDevicesProperties.getDefaultWindow();
            int requestedLimit = limit != null ? limit : topDevicesProperties.getDefaultLimit();
            if (effectiveWindow.isNegative() || effectiveWindow.isZero()) {
                return Mono.error(new InvalidQueryException("Window must be positive, got " + effectiveWindow));
            }
            if (effectiveWindow.compareTo(topDevicesProperties.getMaxWindow()) > 0) {
                return Mono.error(new InvalidQueryException("Window " + effectiveWindow + " exceeds the maximum of "
                        + topDevicesProperties.getMaxWindow()));
            }
            if (requestedLimit <= 0) {
                return Mono.error(new InvalidQueryException("Limit must be positive, got " + requestedLimit));
            }
            int effectiveLimit = Math.min(requestedLimit, topDevicesProperties.getMaxLimit());

            Instant now = clock.instant();
            Instant start = Granularity.DEVICE_1H.alignDown(now.minus(effectiveWindow));
            log.debug("Ranking devices of household {} over [{}, {}), limit {}", householdId, start, now, effectiveLimit);

            return aggregateStoreService.getDeviceHourBucketsForHousehold(householdId, start, now)
                    .filter(bucket -> bucket.getScopeId() != null)
                    .collect(Collectors.groupingBy(AggregateBucket::getScopeId,
                            Collectors.summingDouble(AggregateBucket::getEnergyWhSum)))
                    .map(totals -> rank(totals, effectiveLimit));
        });
    }

    @VisibleForTesting
    static Granularity sourceGranularity(Scope scope, Step step) {
        switch (scope) {
            case DEVICE:
                return step == Step.ONE_HOUR ? Granularity.DEVICE_1H : Granularity.DEVICE_1M;
            case HOUSEHOLD:
                if (step == Step.ONE_MINUTE) {
                    throw new InvalidQueryException("Household series are served at 5m or 1h steps, not 1m");
                }
                return Granularity.HOUSEHOLD_5M;
            default:
                throw new InvalidQueryException("Unsupported scope: " + scope);
        }
    }

    /**
     * Sums source buckets into epoch-aligned steps. A no-op grouping when the widths already match. A step
     * with any provisional bucket is provisional.
     */
    @VisibleForTesting
    static List<SeriesPoint> rebucket(List<AggregateBucket> buckets, Step step) {
        Map<Instant, SeriesPoint> pointByStep = new TreeMap<>();
        for (AggregateBucket bucket : buckets) {
            Instant stepStart = step.alignDown(bucket.getBucketStart());
            pointByStep.merge(stepStart,
                    new SeriesPoint(stepStart, bucket.getEnergyWhSum(), bucket.isProvisional()),
                    SeriesPoint::merge);
        }
        return List.copyOf(pointByStep.values());
    }

    private static void validateRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidQueryException("Both start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new InvalidQueryException("Start " + start + " must be before end " + end);
        }
    }

    private Mono<EnergySeries> fromCache(CacheKey key, CachedValue cached) {
        return Mono.fromCallable(() -> objectMapper.readValue(cached.getPayload(), SERIES_TYPE))
                .map(points -> EnergySeries.builder().freshAsOf(cached.getFreshAsOf()).series(points).build())
                .doOnNext(series -> log.debug("Cache hit {} (fresh as of {})", key, cached.getFreshAsOf()))
                .onErrorResume(e -> {
                    log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<EnergySeries> readThrough(CacheKey key, Granularity source) {
        log.debug("Cache miss {}, reading {}", key, source.collectionName());
        return aggregateStoreService.getBuckets(key.getScope(), key.getScopeId(), source, key.getStart(), key.getEnd())
                .collectList()
                .map(buckets -> EnergySeries.builder()
                        .freshAsOf(clock.instant())
                        .series(rebucket(buckets, key.getStep()))
                        .build())
                .flatMap(series -> writeBack(key, series).thenReturn(series));
    }

    private Mono<Void> writeBack(CacheKey key, EnergySeries series) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(series.getSeries()))
                .flatMap(payload -> aggregateCache.set(key,
                        new CachedValue(payload, series.getFreshAsOf()), cacheTtlPolicy.nextTtl()))
                .onErrorResume(e -> {
                    log.warn("Could not cache {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private static List<DeviceEnergy> rank(Map<String, Double> totalsWh, int limit) {
        double householdTotalWh = totalsWh.values().stream()
                .filter(total -> total > 0)
                .mapToDouble(Double::doubleValue)
                .sum();
        return totalsWh.entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(limit)
                .map(entry -> DeviceEnergy.builder()
                        .deviceId(entry.getKey())
                        .energyKwh(entry.getValue() / WH_PER_KWH)
                        .shareOfTotalPercent(entry.getValue() / householdTotalWh * 100)
                        .build())
                .toList();
    }
}
