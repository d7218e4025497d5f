package dev.devanks.energy.aggregates.config;

import dev.devanks.energy.aggregates.model.Granularity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RollupPolicyPropertiesTest {

    private final RollupPolicyProperties properties = new RollupPolicyProperties();

    @ParameterizedTest
    @CsvSource({
            "DEVICE_1M, PT1M30S",
            "HOUSEHOLD_5M, PT7M",
            "DEVICE_1H, PT1H10M"
    })
    @DisplayName("stalenessBound is schedule interval plus end offset")
    void stalenessBound_defaults(Granularity granularity, String expected) {
        assertThat(properties.stalenessBound(granularity)).isEqualTo(Duration.parse(expected));
    }

    @ParameterizedTest
    @CsvSource({
            "PT12H, true",
            "PT18H, true",
            "P1D, true",
            "PT6H, false",
            "P2D, false"
    })
    @DisplayName("chunk interval accepts 12 hours up to one day")
    void chunkInterval_bounds(String chunk, boolean supported) {
        properties.setChunkInterval(Duration.parse(chunk));

        assertThat(properties.isChunkIntervalSupported()).isEqualTo(supported);
    }

    @Test
    @DisplayName("policyFor returns the overridden policy")
    void policyFor_override() {
        var custom = new RollupPolicyProperties.Policy(Duration.ofSeconds(15), Duration.ofHours(1), Duration.ofSeconds(30));
        properties.setDevice1m(custom);

        assertThat(properties.policyFor(Granularity.DEVICE_1M)).isSameAs(custom);
        assertThat(properties.stalenessBound(Granularity.DEVICE_1M)).isEqualTo(Duration.ofSeconds(45));
    }
}
