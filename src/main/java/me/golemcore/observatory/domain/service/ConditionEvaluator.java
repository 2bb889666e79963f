package me.golemcore.observatory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.observatory.domain.component.MoonPhaseCalculator;
import me.golemcore.observatory.domain.model.EquipmentStatus;
import me.golemcore.observatory.domain.model.EvaluationContext;
import me.golemcore.observatory.domain.model.Observability;
import me.golemcore.observatory.domain.model.ObservationQuery;
import me.golemcore.observatory.domain.model.ScheduleCondition;
import me.golemcore.observatory.domain.model.ScheduleRule;
import me.golemcore.observatory.domain.model.WeatherSnapshot;
import me.golemcore.observatory.port.outbound.ObservabilityPort;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Evaluates {@link ScheduleCondition}s against an {@link EvaluationContext}.
 *
 * <p>
 * Evaluation fails open: a condition whose input is missing from the context
 * (no weather, no equipment, no target or location), whose value cannot be
 * read, or whose operator does not apply to its type evaluates to
 * {@code true}. Callers that need fail-closed behaviour for weather or
 * equipment must make sure the context carries the data.
 *
 * <p>
 * Time-range conditions always compare against the wall clock, not against
 * {@link EvaluationContext#getDate()}.
 */
@Service
@Slf4j
public class ConditionEvaluator {

    private static final String CLOUD_COVER = "cloud_cover";
    private static final String WIND_SPEED = "wind_speed";
    private static final String HUMIDITY = "humidity";

    private final ObservabilityPort observabilityPort;
    private final MoonPhaseCalculator moonPhaseCalculator;
    private final Clock clock;

    public ConditionEvaluator(ObservabilityPort observabilityPort, MoonPhaseCalculator moonPhaseCalculator,
            Clock clock) {
        this.observabilityPort = observabilityPort;
        this.moonPhaseCalculator = moonPhaseCalculator;
        this.clock = clock;
    }

    public boolean evaluate(ScheduleCondition condition, EvaluationContext context) {
        if (condition.getType() == null) {
            return true;
        }
        EvaluationContext ctx = context != null ? context : EvaluationContext.empty();
        return switch (condition.getType()) {
        case TIME_RANGE -> evaluateTimeRange(condition);
        case ALTITUDE -> evaluateAltitude(condition, ctx);
        case WEATHER -> evaluateWeather(condition, ctx);
        case MOON_PHASE -> evaluateMoonPhase(condition, ctx);
        case EQUIPMENT_STATUS -> evaluateEquipment(ctx);
        case CUSTOM -> true;
        };
    }

    /**
     * A rule holds when it is enabled and every condition holds. A rule without
     * conditions always holds.
     */
    public boolean evaluateRule(ScheduleRule rule, EvaluationContext context) {
        if (!rule.isEnabled()) {
            return false;
        }
        return rule.getConditions().stream().allMatch(condition -> evaluate(condition, context));
    }

    private boolean evaluateTimeRange(ScheduleCondition condition) {
        Instant now = clock.instant();
        JsonNode value = condition.getValue();
        if (value == null || condition.getOperator() == null) {
            return true;
        }
        try {
            return switch (condition.getOperator()) {
            case BETWEEN -> {
                Instant start = Instant.parse(value.path("start").asText());
                Instant end = Instant.parse(value.path("end").asText());
                yield !now.isBefore(start) && !now.isAfter(end);
            }
            case GREATER_THAN -> now.isAfter(Instant.parse(value.asText()));
            case LESS_THAN -> now.isBefore(Instant.parse(value.asText()));
            default -> true;
            };
        } catch (DateTimeParseException e) {
            log.debug("[Conditions] Unreadable time range {}: {}", value, e.getMessage());
            return true;
        }
    }

    private boolean evaluateAltitude(ScheduleCondition condition, EvaluationContext context) {
        if (context.getTarget() == null || context.getLocation() == null) {
            return true;
        }
        Instant date = context.getDate() != null ? context.getDate() : clock.instant();
        Observability observability = observabilityPort.computeObservability(
                context.getTarget(), ObservationQuery.of(context.getLocation(), date));
        double altitude = observability.getAltitude() != null ? observability.getAltitude() : 0.0;
        return compare(altitude, condition);
    }

    private boolean evaluateWeather(ScheduleCondition condition, EvaluationContext context) {
        WeatherSnapshot weather = context.getWeather();
        JsonNode value = condition.getValue();
        if (weather == null || value == null) {
            return true;
        }
        Double reading = switch (value.path("parameter").asText()) {
        case CLOUD_COVER -> weather.getCloudCover();
        case WIND_SPEED -> weather.getWindSpeed();
        case HUMIDITY -> weather.getHumidity();
        default -> null;
        };
        JsonNode threshold = value.path("threshold");
        if (reading == null || !threshold.isNumber()) {
            return true;
        }
        ScheduleCondition.Operator operator = condition.getOperator();
        if (operator == null || !operator.isOrdering()) {
            operator = ScheduleCondition.Operator.LESS_OR_EQUAL;
        }
        return compareOrdering(reading, operator, threshold.asDouble());
    }

    private boolean evaluateMoonPhase(ScheduleCondition condition, EvaluationContext context) {
        Instant date = context.getDate() != null ? context.getDate() : clock.instant();
        double phase = moonPhaseCalculator.phaseAt(date);
        return compare(phase, condition);
    }

    private boolean evaluateEquipment(EvaluationContext context) {
        EquipmentStatus equipment = context.getEquipment();
        if (equipment == null) {
            return true;
        }
        return equipment.isReady();
    }

    private boolean compare(double actual, ScheduleCondition condition) {
        ScheduleCondition.Operator operator = condition.getOperator();
        JsonNode value = condition.getValue();
        if (operator == null || value == null) {
            return true;
        }
        if (operator.isOrdering()) {
            return !value.isNumber() || compareOrdering(actual, operator, value.asDouble());
        }
        if (operator == ScheduleCondition.Operator.EQUAL) {
            double tolerance = condition.getTolerance() != null ? condition.getTolerance() : 0.0;
            return !value.isNumber() || Math.abs(actual - value.asDouble()) <= tolerance;
        }
        if (operator == ScheduleCondition.Operator.BETWEEN) {
            JsonNode min = value.path("min");
            JsonNode max = value.path("max");
            if (!min.isNumber() || !max.isNumber()) {
                return true;
            }
            return actual >= min.asDouble() && actual <= max.asDouble();
        }
        return true;
    }

    private static boolean compareOrdering(double actual, ScheduleCondition.Operator operator, double threshold) {
        return switch (operator) {
        case LESS_THAN -> actual < threshold;
        case GREATER_THAN -> actual > threshold;
        case LESS_OR_EQUAL -> actual <= threshold;
        case GREATER_OR_EQUAL -> actual >= threshold;
        default -> true;
        };
    }
}
