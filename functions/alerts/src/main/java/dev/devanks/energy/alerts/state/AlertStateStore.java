package dev.devanks.energy.alerts.state;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Last trigger time per rule. Arming goes through {@link #compareAndSet} so that two workers sharing a
 * store cannot both fire a rule inside the same cooldown.
 */
public interface AlertStateStore {

    /**
     * @return the last trigger time, or empty if the rule never fired.
     */
    Mono<Instant> lastTriggered(String ruleId);

    /**
     * Sets the trigger time to {@code next} only if it still equals {@code expected}.
     *
     * @param expected the value read earlier; {@code null} when the rule had never fired.
     * @return true if this caller armed the rule.
     */
    Mono<Boolean> compareAndSet(String ruleId, Instant expected, Instant next);
}
