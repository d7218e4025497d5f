package dev.devanks.energy.analytics.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.analytics.exception.InvalidQueryException;
import dev.devanks.energy.analytics.model.DeviceEnergy;
import dev.devanks.energy.analytics.model.EnergySeries;
import dev.devanks.energy.analytics.model.EnergySeriesRequest;
import dev.devanks.energy.analytics.model.EnergySeriesResponse;
import dev.devanks.energy.analytics.model.RangePreset;
import dev.devanks.energy.analytics.model.Step;
import dev.devanks.energy.analytics.model.TopDevicesRequest;
import dev.devanks.energy.analytics.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsFunction {

    private final AnalyticsService analyticsService;

    /**
     * Function bean: energySeries.
     */
    @Bean
    public Function<EnergySeriesRequest, EnergySeriesResponse> energySeries() {
        return request -> {
            log.info("energySeries function triggered with request: {}", request);
            EnergySeries series = seriesFor(request).block();
            log.info("energySeries served {} points for {} {} (fresh as of {})",
                    series.getSeries().size(), request.getScope(), request.getScopeId(), series.getFreshAsOf());
            return EnergySeriesResponse.from(series);
        };
    }

    /**
     * Function bean: topDevices.
     */
    @Bean
    public Function<TopDevicesRequest, List<DeviceEnergy>> topDevices() {
        return request -> {
            log.info("topDevices function triggered with request: {}", request);
            if (request == null || isBlank(request.getHouseholdId())) {
                throw new InvalidQueryException("householdId is required");
            }
            Duration window = isBlank(request.getWindow()) ? null : parseDuration(request.getWindow());
            return analyticsService.topDevices(request.getHouseholdId(), window, request.getLimit()).block();
        };
    }

    @VisibleForTesting
    Mono<EnergySeries> seriesFor(EnergySeriesRequest request) {
        return Mono.defer(() -> {
            if (request == null || isBlank(request.getScopeId())) {
                return Mono.error(new InvalidQueryException("scopeId is required"));
            }
            Scope scope = parseScope(request.getScope());
            Step step = Step.fromWireName(request.getStep());
            if (!isBlank(request.getRange())) {
                return analyticsService.energyByPreset(scope, request.getScopeId(),
                        RangePreset.fromWireName(request.getRange()), step);
            }
            return analyticsService.energyByScope(scope, request.getScopeId(),
                    parseInstant(request.getStart()), parseInstant(request.getEnd()), step);
        });
    }

    private static Scope parseScope(String value) {
        try {
            return Scope.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
    }

    private static Instant parseInstant(String value) {
        if (isBlank(value)) {
            throw new InvalidQueryException("start and end are required when no range is given");
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("Invalid ISO-8601 instant: " + value, e);
        }
    }

    private static Duration parseDuration(String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("Invalid ISO-8601 duration: " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
