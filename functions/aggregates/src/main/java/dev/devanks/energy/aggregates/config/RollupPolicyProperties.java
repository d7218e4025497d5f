package dev.devanks.energy.aggregates.config;

import dev.devanks.energy.aggregates.model.Granularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Refresh policy of each rollup table. The rollup engine applies these; readers use them to
 * decide how stale a bucket may be and whether it can still change.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "rollups")
public class RollupPolicyProperties {

    private static final Duration MIN_CHUNK_INTERVAL = Duration.ofHours(12);
    private static final Duration MAX_CHUNK_INTERVAL = Duration.ofDays(1);

    @Data
    @Validated
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        /**
         * How often the engine refreshes the table.
         */
        @NotNull
        private Duration scheduleInterval;

        /**
         * Oldest bucket boundary (relative to now) a refresh recomputes.
         */
        @NotNull
        private Duration startOffset;

        /**
         * Recency exclusion window: buckets newer than now minus this are not materialized yet.
         */
        @NotNull
        private Duration endOffset;

        public Duration stalenessBound() {
            return scheduleInterval.plus(endOffset);
        }
    }

    @Valid
    @NotNull
    private Policy device1m = new Policy(Duration.ofSeconds(30), Duration.ofHours(2), Duration.ofMinutes(1));

    @Valid
    @NotNull
    private Policy household5m = new Policy(Duration.ofMinutes(2), Duration.ofHours(6), Duration.ofMinutes(5));

    @Valid
    @NotNull
    private Policy device1h = new Policy(Duration.ofMinutes(10), Duration.ofDays(3), Duration.ofHours(1));

    /**
     * Chunk size of the raw reading source. One day by default, 12 hours under high ingest volume.
     */
    @NotNull
    private Duration chunkInterval = MAX_CHUNK_INTERVAL;

    public Policy policyFor(Granularity granularity) {
        return switch (granularity) {
            case DEVICE_1M -> device1m;
            case HOUSEHOLD_5M -> household5m;
            case DEVICE_1H -> device1h;
        };
    }

    public Duration stalenessBound(Granularity granularity) {
        return policyFor(granularity).stalenessBound();
    }

    @AssertTrue(message = "rollups.chunk-interval must be between 12 hours and 1 day")
    public boolean isChunkIntervalSupported() {
        return chunkInterval != null
                && chunkInterval.compareTo(MIN_CHUNK_INTERVAL) >= 0
                && chunkInterval.compareTo(MAX_CHUNK_INTERVAL) <= 0;
    }
}
