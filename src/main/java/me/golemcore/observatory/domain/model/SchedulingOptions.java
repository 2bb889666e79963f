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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable input of one scheduling run.
 */
@Value
@Builder
public class SchedulingOptions {

    Instant startDate;
    Instant endDate;
    Location location;
    Constraints constraints;

    /**
     * Observer position in degrees.
     */
    @Value
    public static class Location {
        double latitude;
        double longitude;
    }

    @Value
    @Builder
    public static class Constraints {

        @Builder.Default
        double minAltitude = 30.0;

        @Builder.Default
        double maxAirmass = 2.0;

        @Singular
        List<String> weatherRequirements;
    }
}
