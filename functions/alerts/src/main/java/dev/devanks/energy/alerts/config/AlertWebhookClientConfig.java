package dev.devanks.energy.alerts.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpHeaders.USER_AGENT;

@RequiredArgsConstructor
@Slf4j
public class AlertWebhookClientConfig {

    static final String USER_AGENT_VALUE = "Energy-Alerts-Worker-Feign/1.0";

    private final AlertsProperties alertsProperties;

    @Bean
    public RequestInterceptor webhookAuthorizationInterceptor() {
        return template -> {
            var token = alertsProperties.getNotifier().getWebhook().getToken();
            if (token != null && !token.isBlank()) {
                log.debug("Adding bearer token to alert webhook request.");
                template.header(AUTHORIZATION, "Bearer " + token);
            }
            template.header(USER_AGENT, USER_AGENT_VALUE);
        };
    }

    @Bean
    public Level webhookFeignLoggerLevel() {
        return BASIC;
    }
}
