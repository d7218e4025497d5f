package dev.devanks.energy.alerts.service;

import dev.devanks.energy.alerts.config.AlertsProperties;
import dev.devanks.energy.alerts.mapper.AlertRuleLoader;
import dev.devanks.energy.alerts.model.AlertRule;
import dev.devanks.energy.alerts.model.CycleSummary;
import dev.devanks.energy.alerts.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-delay polling loop. Rules are evaluated one after another; a failing rule never stops the cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertsWorker {

    private final AlertRuleLoader alertRuleLoader;
    private final AlertEvaluationService alertEvaluationService;
    private final AlertsProperties alertsProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${alerts.poll-interval-ms:10000}")
    public void poll() {
        if (!alertsProperties.isEnabled()) {
            return;
        }
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Alert cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one evaluation pass over every rule.
     */
    public CycleSummary runCycle() {
        Instant startedAt = clock.instant();
        Map<String, RuleOutcome> outcomes = new LinkedHashMap<>();
        for (AlertRule rule : alertRuleLoader.getRules()) {
            outcomes.put(rule.getId(), evaluateSafely(rule));
        }
        CycleSummary summary = new CycleSummary(startedAt, Duration.between(startedAt, clock.instant()), outcomes);

        log.info("Alert cycle done in {} ms: rules={} fired={} suppressed={} below={} noData={} failed={}",
                summary.getElapsed().toMillis(), outcomes.size(),
                summary.count(RuleOutcome.FIRED), summary.count(RuleOutcome.SUPPRESSED),
                summary.count(RuleOutcome.BELOW_THRESHOLD), summary.count(RuleOutcome.NO_DATA),
                summary.count(RuleOutcome.FAILED));
        return summary;
    }

    private RuleOutcome evaluateSafely(AlertRule rule) {
        try {
            RuleOutcome outcome = alertEvaluationService.evaluate(rule, clock.instant()).block();
            return outcome != null ? outcome : RuleOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Rule {} failed outside evaluation: {}", rule.getId(), e.getMessage(), e);
            return RuleOutcome.FAILED;
        }
    }
}
