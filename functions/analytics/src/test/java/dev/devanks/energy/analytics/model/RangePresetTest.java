package dev.devanks.energy.analytics.model;

import dev.devanks.energy.analytics.exception.InvalidQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RangePresetTest {

    @ParameterizedTest
    @CsvSource({
            "HOUR, ONE_MINUTE, true",
            "DAY, ONE_MINUTE, false",
            "DAY, FIVE_MINUTES, true",
            "DAY, ONE_HOUR, true",
            "WEEK, FIVE_MINUTES, false",
            "MONTH, ONE_HOUR, true"
    })
    @DisplayName("allows - Step must be at least the preset's minimum")
    void allows(RangePreset preset, Step step, boolean allowed) {
        assertThat(preset.allows(step)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("fromWireName - Unknown preset is an invalid query")
    void fromWireName_unknown() {
        assertThat(RangePreset.fromWireName("Week")).isEqualTo(RangePreset.WEEK);
        assertThatThrownBy(() -> RangePreset.fromWireName("year"))
                .isInstanceOf(InvalidQueryException.class);
        assertThat(Step.fromWireName("1h")).isEqualTo(Step.ONE_HOUR);
    }
}
