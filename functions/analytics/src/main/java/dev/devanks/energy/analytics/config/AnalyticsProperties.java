package dev.devanks.energy.analytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    public enum CacheBackend {
        NONE, LOCAL, REDIS
    }

    @Data
    @Validated
    public static class CacheProperties {
        @NotNull
        private CacheBackend backend = CacheBackend.NONE;
        @NotNull
        private Duration baseTtl = Duration.ofSeconds(60);
        @NotNull
        private Duration jitterMax = Duration.ofSeconds(12);
        // Upper bound for a single Redis round trip
        @NotNull
        private Duration operationTimeout = Duration.ofMillis(200);
        @Positive
        private int localMaxEntries = 10_000;
    }

    @Data
    @Validated
    public static class TopDevicesProperties {
        @NotNull
        private Duration defaultWindow = Duration.ofDays(1);
        // Longest trailing window a caller may ask for
        @NotNull
        private Duration maxWindow = Duration.ofDays(366);
        @Positive
        private int defaultLimit = 5;
        @Positive
        private int maxLimit = 100;
    }

    @Valid
    @NotNull
    private CacheProperties cache = new CacheProperties();

    @Valid
    @NotNull
    private TopDevicesProperties topDevices = new TopDevicesProperties();
}
