package dev.devanks.energy.analytics.cache;

import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.analytics.model.Step;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Identity of a cached query. Rendered as
 * {@code agg:{metric}:{scope}:{scope_id}:{start}:{end}:{step}} with UTC timestamps, e.g.
 * {@code agg:energy_wh_sum:household:h1:2025-07-29T00:00Z:2025-07-30T00:00Z:5m}.
 */
@Value
@Builder
public class CacheKey {

    private static final String PREFIX = "agg";
    private static final char SEPARATOR = ':';

    @NonNull String metric;
    @NonNull Scope scope;
    @NonNull String scopeId;
    @NonNull Instant start;
    @NonNull Instant end;
    @NonNull Step step;

    public String render() {
        return PREFIX + SEPARATOR + metric
                + SEPARATOR + scope.wireName()
                + SEPARATOR + escape(scopeId)
                + SEPARATOR + OffsetDateTime.ofInstant(start, ZoneOffset.UTC)
                + SEPARATOR + OffsetDateTime.ofInstant(end, ZoneOffset.UTC)
                + SEPARATOR + step.wireName();
    }

    // Ids may contain the separator; percent-escape so the rendered key stays unambiguous.
    static String escape(String value) {
        return value.replace("%", "%25").replace(":", "%3A");
    }

    @Override
    public String toString() {
        return render();
    }
}
