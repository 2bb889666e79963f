package me.golemcore.observatory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the observatory scheduler, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code observatory.*} prefix:
 * <ul>
 * <li>{@link SchedulerProperties} - time-slot search tuning</li>
 * <li>{@link ObservabilityProperties} - remote observability oracle</li>
 * <li>{@link HttpProperties} - shared HTTP client timeouts and pooling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "observatory")
@Data
public class ObservatoryProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private ObservabilityProperties observability = new ObservabilityProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SchedulerProperties {
        private Duration slotIncrement = Duration.ofMinutes(15);
        private VisibilitySampling visibilitySampling = VisibilitySampling.MIDPOINT;
    }

    @Data
    public static class ObservabilityProperties {
        private String baseUrl = "http://localhost:8090";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    /**
     * Points inside a candidate window at which visibility is sampled.
     */
    public enum VisibilitySampling {
        /**
         * Midpoint only. The target may be out of range near the window edges.
         */
        MIDPOINT,

        /**
         * Start, midpoint and end must all be feasible.
         */
        ENDPOINTS
    }
}
