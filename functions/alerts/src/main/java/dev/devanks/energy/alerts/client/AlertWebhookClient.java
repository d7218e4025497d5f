package dev.devanks.energy.alerts.client;

import dev.devanks.energy.alerts.config.AlertWebhookClientConfig;
import dev.devanks.energy.alerts.model.AlertNotification;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Outbound alert channel. Authentication is handled by AlertWebhookClientConfig.
 */
@FeignClient(name = "alert-webhook",
        url = "${alerts.notifier.webhook.url:http://localhost:8089}",
        configuration = AlertWebhookClientConfig.class)
public interface AlertWebhookClient {

    @PostMapping(consumes = "application/json")
    void postAlert(@RequestBody AlertNotification notification);
}
