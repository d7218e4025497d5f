package dev.devanks.energy.alerts.notifier;

import dev.devanks.energy.alerts.model.AlertRule;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public Mono<Void> send(AlertRule rule, double value, Instant bucketTimestamp) {
        return Mono.fromRunnable(() -> log.warn("ALERT {}: value {} for bucket {}",
                rule.describe(), value, bucketTimestamp));
    }
}
