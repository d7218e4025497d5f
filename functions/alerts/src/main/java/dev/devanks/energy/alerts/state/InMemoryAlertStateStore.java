package dev.devanks.energy.alerts.state;

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local state. Lost on restart and not shared between instances.
 */
public class InMemoryAlertStateStore implements AlertStateStore {

    private final ConcurrentMap<String, Instant> lastTriggered = new ConcurrentHashMap<>();

    @Override
    public Mono<Instant> lastTriggered(String ruleId) {
        return Mono.fromSupplier(() -> lastTriggered.get(ruleId));
    }

    @Override
    public Mono<Boolean> compareAndSet(String ruleId, Instant expected, Instant next) {
        return Mono.fromSupplier(() -> expected == null
                ? lastTriggered.putIfAbsent(ruleId, next) == null
                : lastTriggered.replace(ruleId, expected, next));
    }
}
