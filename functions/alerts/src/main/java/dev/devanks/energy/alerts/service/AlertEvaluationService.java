package dev.devanks.energy.alerts.service;

import dev.devanks.energy.aggregates.config.RollupPolicyProperties;
import dev.devanks.energy.aggregates.model.AggregateBucket;
import dev.devanks.energy.aggregates.service.AggregateStoreService;
import dev.devanks.energy.alerts.config.AlertsProperties;
import dev.devanks.energy.alerts.model.AlertRule;
import dev.devanks.energy.alerts.model.RuleOutcome;
import dev.devanks.energy.alerts.notifier.Notifier;
import dev.devanks.energy.alerts.state.AlertStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a single rule against its latest bucket and drives the rule's cooldown.
 *
 * <p>A rule is idle when it never fired or its cooldown has elapsed, and cooling down otherwise. Only an
 * actual dispatch arms the cooldown; readings below the threshold leave the state untouched. The
 * returned outcome never carries an error: failures are logged and reported as {@link RuleOutcome#FAILED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluationService {

    private final AggregateStoreService aggregateStoreService;
    private final AlertStateStore alertStateStore;
    private final Notifier notifier;
    private final AlertsProperties alertsProperties;
    private final RollupPolicyProperties rollupPolicyProperties;

    public Mono<RuleOutcome> evaluate(AlertRule rule, Instant now) {
        return latestBucket(rule, now)
                .flatMap(latest -> latest
                        .map(bucket -> evaluateBucket(rule, bucket, now))
                        .orElseGet(() -> {
                            log.debug("No recent bucket for rule {}, skipping.", rule.getId());
                            return Mono.just(RuleOutcome.NO_DATA);
                        }))
                .onErrorResume(e -> {
                    log.error("Evaluation of rule {} failed: {}", rule.getId(), e.getMessage(), e);
                    return Mono.just(RuleOutcome.FAILED);
                });
    }

    // Wrapped so an empty fetch and a failed fetch stay distinguishable downstream.
    private Mono<Optional<AggregateBucket>> latestBucket(AlertRule rule, Instant now) {
        Instant start = now.minus(rule.fetchWindow(alertsProperties.getTrailingWindow(), settleDelay(rule)));
        return aggregateStoreService.getBuckets(rule.getScope(), rule.getScopeId(), rule.granularity(), start, now)
                .collectList()
                .timeout(alertsProperties.getFetchTimeout())
                .map(buckets -> pickLatest(rule, buckets));
    }

    // With skip-provisional the window must reach back far enough to hold a bucket that has settled.
    private Duration settleDelay(AlertRule rule) {
        return alertsProperties.isSkipProvisional()
                ? rollupPolicyProperties.stalenessBound(rule.granularity())
                : Duration.ZERO;
    }

    private Optional<AggregateBucket> pickLatest(AlertRule rule, List<AggregateBucket> buckets) {
        for (int i = buckets.size() - 1; i >= 0; i--) {
            AggregateBucket bucket = buckets.get(i);
            if (!bucket.isProvisional() || !alertsProperties.isSkipProvisional()) {
                return Optional.of(bucket);
            }
            log.debug("Rule {} skips provisional bucket {}", rule.getId(), bucket.getBucketStart());
        }
        return Optional.empty();
    }

    private Mono<RuleOutcome> evaluateBucket(AlertRule rule, AggregateBucket bucket, Instant now) {
        double value = rule.getMetric().valueOf(bucket);
        if (!rule.isBreachedBy(value)) {
            log.debug("Rule {} below threshold: {} at {}", rule.getId(), value, bucket.getBucketStart());
            return Mono.just(RuleOutcome.BELOW_THRESHOLD);
        }

        return alertStateStore.lastTriggered(rule.getId())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(lastTriggered -> {
                    if (lastTriggered.isPresent() && now.isBefore(lastTriggered.get().plus(rule.getCooldown()))) {
                        log.info("Rule {} breached ({}) but cooling down until {}", rule.getId(), value,
                                lastTriggered.get().plus(rule.getCooldown()));
                        return Mono.just(RuleOutcome.SUPPRESSED);
                    }
                    return arm(rule, lastTriggered.orElse(null), now)
                            .flatMap(armed -> armed
                                    ? dispatch(rule, value, bucket)
                                    : Mono.just(RuleOutcome.SUPPRESSED));
                });
    }

    private Mono<Boolean> arm(AlertRule rule, Instant expected, Instant now) {
        return alertStateStore.compareAndSet(rule.getId(), expected, now);
    }

    // The cooldown is already armed here, whatever the dispatch result.
    private Mono<RuleOutcome> dispatch(AlertRule rule, double value, AggregateBucket bucket) {
        log.info("Rule {} fired: {} at {}{}", rule.describe(), value, bucket.getBucketStart(),
                bucket.isProvisional() ? " (provisional)" : "");
        return notifier.send(rule, value, bucket.getBucketStart())
                .thenReturn(RuleOutcome.FIRED)
                .onErrorResume(e -> {
                    log.warn("Notification for rule {} failed, not retried until cooldown elapses: {}",
                            rule.getId(), e.getMessage());
                    return Mono.just(RuleOutcome.FAILED);
                });
    }
}
