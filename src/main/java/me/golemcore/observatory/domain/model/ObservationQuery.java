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

import java.time.Instant;

/**
 * Where and when to evaluate a target's visibility.
 */
public record ObservationQuery(double latitude, double longitude, Instant date) {

    public static ObservationQuery of(SchedulingOptions.Location location, Instant date) {
        return new ObservationQuery(location.getLatitude(), location.getLongitude(), date);
    }
}
