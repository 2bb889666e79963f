package me.golemcore.observatory.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * A single predicate attached to a {@link ScheduleRule}. Immutable once built.
 *
 * <p>
 * The shape of {@link #value} depends on {@link #type}:
 * <ul>
 * <li>{@code TIME_RANGE} - {@code {"start": iso, "end": iso}} for
 * {@code between}, a single ISO-8601 instant otherwise</li>
 * <li>{@code ALTITUDE} - degrees, or {@code {"min": .., "max": ..}} for
 * {@code between}</li>
 * <li>{@code WEATHER} - {@code {"parameter": "cloud_cover", "threshold": 30}}</li>
 * <li>{@code MOON_PHASE} - phase fraction in [0, 1)</li>
 * <li>{@code EQUIPMENT_STATUS} - ignored</li>
 * </ul>
 */
@Value
@Builder
public class ScheduleCondition {

    String id;
    ConditionType type;
    Operator operator;
    JsonNode value;
    String unit;
    Double tolerance;

    /**
     * Condition kinds understood by the evaluator.
     */
    public enum ConditionType {
        TIME_RANGE, ALTITUDE, WEATHER, MOON_PHASE, EQUIPMENT_STATUS, CUSTOM
    }

    /**
     * Comparison operators.
     */
    public enum Operator {
        LESS_THAN("<"),
        GREATER_THAN(">"),
        EQUAL("="),
        GREATER_OR_EQUAL(">="),
        LESS_OR_EQUAL("<="),
        BETWEEN("between"),
        IN("in"),
        NOT_IN("not_in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @JsonValue
        public String getSymbol() {
            return symbol;
        }

        /**
         * Whether this operator orders a single value against a threshold.
         */
        public boolean isOrdering() {
            return this == LESS_THAN || this == GREATER_THAN
                    || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown condition operator: " + symbol);
        }
    }
}
