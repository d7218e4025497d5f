package dev.devanks.energy.alerts.notifier;

import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.alerts.client.AlertWebhookClient;
import dev.devanks.energy.alerts.exception.NotificationException;
import dev.devanks.energy.alerts.model.AlertMetric;
import dev.devanks.energy.alerts.model.AlertNotification;
import dev.devanks.energy.alerts.model.AlertRule;
import dev.devanks.energy.alerts.model.ComparisonOperator;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookNotifierTest {

    @Mock
    private AlertWebhookClient mockAlertWebhookClient;
    @Captor
    private ArgumentCaptor<AlertNotification> notificationCaptor;

    private WebhookNotifier webhookNotifier;

    private static final Instant NOW = Instant.parse("2025-07-30T12:00:07Z");
    private static final Instant BUCKET = Instant.parse("2025-07-30T11:55:00Z");

    private static final AlertRule RULE = AlertRule.builder()
            .id("high-usage")
            .scope(Scope.HOUSEHOLD)
            .scopeId("h1")
            .metric(AlertMetric.ENERGY_WH_SUM)
            .window(Duration.ofMinutes(5))
            .operator(ComparisonOperator.GT)
            .threshold(500.0)
            .cooldown(Duration.ofMinutes(5))
            .build();

    @BeforeEach
    void setUp() {
        webhookNotifier = new WebhookNotifier(mockAlertWebhookClient, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("send - Posts the rule, value and bucket time")
    void send_success() {
        StepVerifier.create(webhookNotifier.send(RULE, 812.5, BUCKET)).verifyComplete();

        verify(mockAlertWebhookClient).postAlert(notificationCaptor.capture());
        AlertNotification notification = notificationCaptor.getValue();
        assertThat(notification.getRuleId()).isEqualTo("high-usage");
        assertThat(notification.getScope()).isEqualTo("household");
        assertThat(notification.getMetric()).isEqualTo("energy_wh_sum");
        assertThat(notification.getOperator()).isEqualTo(">");
        assertThat(notification.getValue()).isEqualTo(812.5);
        assertThat(notification.getBucketTimestamp()).isEqualTo("2025-07-30T11:55:00Z");
        assertThat(notification.getTriggeredAt()).isEqualTo("2025-07-30T12:00:07Z");
    }

    @Test
    @DisplayName("send - Feign failure surfaces as NotificationException, with a single attempt")
    void send_failure() {
        Request dummyRequest = Request.create(Request.HttpMethod.POST, "/alerts", Collections.emptyMap(), null, StandardCharsets.UTF_8, null);
        FeignException feignException = new FeignException.ServiceUnavailable("Service down", dummyRequest, null, Collections.emptyMap());
        doThrow(feignException).when(mockAlertWebhookClient).postAlert(any());

        StepVerifier.create(webhookNotifier.send(RULE, 812.5, BUCKET))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NotificationException.class)
                        .hasMessageContaining("high-usage")
                        .hasCauseInstanceOf(FeignException.class))
                .verify();

        verify(mockAlertWebhookClient, times(1)).postAlert(any());
    }

    @Test
    @DisplayName("LoggingNotifier - Completes without side effects")
    void loggingNotifier_completes() {
        StepVerifier.create(new LoggingNotifier().send(RULE, 812.5, BUCKET)).verifyComplete();
    }
}
