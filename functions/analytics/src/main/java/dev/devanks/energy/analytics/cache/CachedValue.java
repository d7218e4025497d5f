package dev.devanks.energy.analytics.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedValue {

    // JSON of the served series
    private String payload;

    private Instant freshAsOf;
}
