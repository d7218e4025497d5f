package dev.devanks.energy.alerts.mapper;

import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.alerts.config.AlertsProperties;
import dev.devanks.energy.alerts.config.AlertsProperties.RuleProperties;
import dev.devanks.energy.alerts.exception.InvalidAlertRuleException;
import dev.devanks.energy.alerts.model.AlertMetric;
import dev.devanks.energy.alerts.model.AlertRule;
import dev.devanks.energy.alerts.model.ComparisonOperator;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns {@code alerts.rules[*]} into validated rules once at startup. Any invalid rule fails startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertRuleLoader {

    private final AlertsProperties alertsProperties;

    @Getter
    private List<AlertRule> rules = List.of();

    @PostConstruct
    void loadConfiguredRules() {
        rules = load(alertsProperties.getRules());
        if (rules.isEmpty()) {
            log.warn("No alert rules configured; the worker will idle.");
        } else {
            log.info("Loaded {} alert rules.", rules.size());
            rules.forEach(rule -> log.info("Alert rule {} reads {}, cooldown {}",
                    rule.describe(), rule.granularity(), rule.getCooldown()));
        }
    }

    public List<AlertRule> load(List<RuleProperties> configured) {
        List<AlertRule> loaded = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < configured.size(); i++) {
            AlertRule rule = toRule(i, configured.get(i));
            if (!seenIds.add(rule.getId())) {
                throw new InvalidAlertRuleException("Duplicate alert rule id: " + rule.getId());
            }
            loaded.add(rule);
        }
        return List.copyOf(loaded);
    }

    private AlertRule toRule(int index, RuleProperties properties) {
        if (isBlank(properties.getId())) {
            throw new InvalidAlertRuleException("alerts.rules[" + index + "].id must not be blank");
        }
        String where = "alerts.rules[" + index + "] (" + properties.getId() + ")";
        if (isBlank(properties.getScopeId())) {
            throw new InvalidAlertRuleException(where + ": scope-id must not be blank");
        }

        Scope scope = parseScope(where, properties.getScope());
        String metricName = properties.getMetric();
        AlertMetric metric = AlertMetric.fromWireName(metricName)
                .orElseThrow(() -> new InvalidAlertRuleException(where + ": unknown metric '" + metricName + "'"));
        String op = properties.getOp();
        ComparisonOperator operator = ComparisonOperator.fromSymbol(op)
                .orElseThrow(() -> new InvalidAlertRuleException(where + ": unknown operator '" + op + "'"));

        Duration window = properties.getWindow();
        if (window == null || window.isZero() || window.isNegative()) {
            throw new InvalidAlertRuleException(where + ": window must be a positive duration");
        }
        Double threshold = properties.getValue();
        if (threshold == null || threshold.isNaN()) {
            throw new InvalidAlertRuleException(where + ": value must be a number");
        }
        Long cooldownSec = properties.getCooldownSec();
        if (cooldownSec == null || cooldownSec <= 0) {
            throw new InvalidAlertRuleException(where + ": cooldown-sec must be positive");
        }

        return AlertRule.builder()
                .id(properties.getId().trim())
                .scope(scope)
                .scopeId(properties.getScopeId().trim())
                .metric(metric)
                .window(window)
                .operator(operator)
                .threshold(threshold)
                .cooldown(Duration.ofSeconds(cooldownSec))
                .build();
    }

    private static Scope parseScope(String where, String value) {
        try {
            return Scope.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidAlertRuleException(where + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
