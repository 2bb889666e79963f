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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Celestial object an imaging sequence points at. Targets are owned by the
 * target catalogue; the scheduler only reads the id and hands the rest to the
 * observability oracle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Target {

    private String id;
    private String name;

    @Builder.Default
    private TargetType type = TargetType.DSO;

    private Coordinates coordinates;

    public enum TargetType {
        DSO, PLANET, MOON, SUN, STAR, CUSTOM
    }

    /**
     * Equatorial coordinates: right ascension in hours, declination in
     * degrees (J2000).
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Coordinates {
        private double ra;
        private double dec;
    }
}
