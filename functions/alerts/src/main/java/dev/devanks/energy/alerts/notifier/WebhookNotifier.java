package dev.devanks.energy.alerts.notifier;

import dev.devanks.energy.alerts.client.AlertWebhookClient;
import dev.devanks.energy.alerts.exception.NotificationException;
import dev.devanks.energy.alerts.model.AlertNotification;
import dev.devanks.energy.alerts.model.AlertRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;

/**
 * Posts alerts through the Feign webhook client. The blocking call runs off the polling thread.
 */
@Slf4j
@RequiredArgsConstructor
public class WebhookNotifier implements Notifier {

    private final AlertWebhookClient alertWebhookClient;
    private final Clock clock;

    @Override
    public Mono<Void> send(AlertRule rule, double value, Instant bucketTimestamp) {
        return Mono.fromRunnable(() -> {
                    AlertNotification notification = AlertNotification.of(rule, value, bucketTimestamp, clock.instant());
                    alertWebhookClient.postAlert(notification);
                    log.info("Alert webhook delivered for rule {}", rule.getId());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> {
                    log.error("Alert webhook failed for rule {}: {}", rule.getId(), e.getMessage(), e);
                    return new NotificationException("Webhook delivery failed for rule " + rule.getId(), e);
                })
                .then();
    }
}
