package dev.devanks.energy.alerts.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertsProperties {

    public enum StateBackend {
        MEMORY, REDIS
    }

    public enum NotifierType {
        LOG, WEBHOOK
    }

    // Rule as written in configuration; checked by AlertRuleLoader.
    @Data
    public static class RuleProperties {
        private String id;
        private String scope;
        private String scopeId;
        private String metric;
        private Duration window;
        private String op;
        private Double value;
        private Long cooldownSec;
    }

    @Data
    @Validated
    public static class StateProperties {
        @NotNull
        private StateBackend backend = StateBackend.MEMORY;
        @NotEmpty
        private String keyPrefix = "alerts:last-triggered:";
        @NotNull
        private Duration operationTimeout = Duration.ofMillis(500);
    }

    @Data
    @Validated
    public static class NotifierProperties {
        @NotNull
        private NotifierType type = NotifierType.LOG;
        @NotNull
        private WebhookProperties webhook = new WebhookProperties();
    }

    @Data
    @Validated
    public static class WebhookProperties {
        @URL
        private String url;
        // Sent as a bearer token when set
        private String token;
    }

    private boolean enabled = true;

    /**
     * Delay between the end of one cycle and the start of the next. Read by the scheduler.
     */
    @Positive
    private long pollIntervalMs = 10_000;

    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(3);

    @NotNull
    private Duration trailingWindow = Duration.ofMinutes(5);

    /**
     * Evaluate the newest finalized bucket instead of a still-provisional newest bucket.
     */
    private boolean skipProvisional = false;

    @Valid
    @NotNull
    private StateProperties state = new StateProperties();

    @Valid
    @NotNull
    private NotifierProperties notifier = new NotifierProperties();

    @NotNull
    private List<RuleProperties> rules = new ArrayList<>();
}
