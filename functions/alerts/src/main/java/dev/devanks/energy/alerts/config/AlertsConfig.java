package dev.devanks.energy.alerts.config;

import dev.devanks.energy.alerts.client.AlertWebhookClient;
import dev.devanks.energy.alerts.notifier.LoggingNotifier;
import dev.devanks.energy.alerts.notifier.Notifier;
import dev.devanks.energy.alerts.notifier.WebhookNotifier;
import dev.devanks.energy.alerts.state.AlertStateStore;
import dev.devanks.energy.alerts.state.InMemoryAlertStateStore;
import dev.devanks.energy.alerts.state.RedisAlertStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AlertsConfig {

    private final AlertsProperties alertsProperties;

    @Bean
    public AlertStateStore alertStateStore(ObjectProvider<ReactiveStringRedisTemplate> redisTemplateProvider) {
        var state = alertsProperties.getState();
        if (state.getBackend() == AlertsProperties.StateBackend.REDIS) {
            log.info("Alert state kept in Redis under prefix '{}'.", state.getKeyPrefix());
            return new RedisAlertStateStore(redisTemplateProvider.getObject(), state.getKeyPrefix(),
                    state.getOperationTimeout());
        }
        log.warn("Alert state kept in memory: it is lost on restart and not shared between instances.");
        return new InMemoryAlertStateStore();
    }

    @Bean
    public Notifier notifier(ObjectProvider<AlertWebhookClient> webhookClientProvider, Clock clock) {
        var notifier = alertsProperties.getNotifier();
        if (notifier.getType() == AlertsProperties.NotifierType.WEBHOOK) {
            if (notifier.getWebhook().getUrl() == null || notifier.getWebhook().getUrl().isBlank()) {
                throw new IllegalStateException("alerts.notifier.webhook.url is required for the WEBHOOK notifier");
            }
            log.info("Alerts are posted to webhook {}.", notifier.getWebhook().getUrl());
            return new WebhookNotifier(webhookClientProvider.getObject(), clock);
        }
        log.info("Alerts are written to the log.");
        return new LoggingNotifier();
    }
}
