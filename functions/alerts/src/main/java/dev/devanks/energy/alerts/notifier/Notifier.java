package dev.devanks.energy.alerts.notifier;

import dev.devanks.energy.alerts.model.AlertRule;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Outbound alert channel. An error signal means the dispatch failed; callers do not retry.
 */
public interface Notifier {

    Mono<Void> send(AlertRule rule, double value, Instant bucketTimestamp);
}
