package dev.devanks.energy.alerts.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class CycleSummary {

    Instant startedAt;
    Duration elapsed;
    Map<String, RuleOutcome> outcomes;

    public CycleSummary(Instant startedAt, Duration elapsed, Map<String, RuleOutcome> outcomes) {
        this.startedAt = startedAt;
        this.elapsed = elapsed;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public long count(RuleOutcome outcome) {
        return outcomes.values().stream().filter(outcome::equals).count();
    }

    public RuleOutcome outcomeOf(String ruleId) {
        return outcomes.get(ruleId);
    }
}
