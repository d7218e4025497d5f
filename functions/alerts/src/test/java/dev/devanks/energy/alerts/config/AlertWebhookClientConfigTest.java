package dev.devanks.energy.alerts.config;

import feign.RequestTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpHeaders.USER_AGENT;

class AlertWebhookClientConfigTest {

    private final AlertsProperties alertsProperties = new AlertsProperties();
    private final AlertWebhookClientConfig config = new AlertWebhookClientConfig(alertsProperties);

    @Test
    @DisplayName("Interceptor adds bearer token when configured")
    void interceptor_withToken() {
        alertsProperties.getNotifier().getWebhook().setToken("s3cret");
        RequestTemplate template = new RequestTemplate();

        config.webhookAuthorizationInterceptor().apply(template);

        assertThat(template.headers().get(AUTHORIZATION)).containsExactly("Bearer s3cret");
        assertThat(template.headers().get(USER_AGENT)).containsExactly(AlertWebhookClientConfig.USER_AGENT_VALUE);
    }

    @Test
    @DisplayName("Interceptor leaves Authorization out without a token")
    void interceptor_withoutToken() {
        RequestTemplate template = new RequestTemplate();

        config.webhookAuthorizationInterceptor().apply(template);

        assertThat(template.headers()).doesNotContainKey(AUTHORIZATION);
    }
}
