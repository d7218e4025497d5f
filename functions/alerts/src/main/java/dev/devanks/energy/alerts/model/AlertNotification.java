package dev.devanks.energy.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// Body posted to the alert webhook.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertNotification {
    private String ruleId;
    private String scope;
    private String scopeId;
    private String metric;
    private String operator;
    private double threshold;
    private double value;
    private String bucketTimestamp;
    private String triggeredAt;

    public static AlertNotification of(AlertRule rule, double value, Instant bucketTimestamp, Instant triggeredAt) {
        return AlertNotification.builder()
                .ruleId(rule.getId())
                .scope(rule.getScope().wireName())
                .scopeId(rule.getScopeId())
                .metric(rule.getMetric().wireName())
                .operator(rule.getOperator().symbol())
                .threshold(rule.getThreshold())
                .value(value)
                .bucketTimestamp(bucketTimestamp.toString())
                .triggeredAt(triggeredAt.toString())
                .build();
    }
}
