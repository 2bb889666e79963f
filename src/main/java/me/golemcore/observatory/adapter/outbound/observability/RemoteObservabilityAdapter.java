package me.golemcore.observatory.adapter.outbound.observability;

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

import me.golemcore.observatory.domain.model.Observability;
import me.golemcore.observatory.domain.model.ObservationQuery;
import me.golemcore.observatory.domain.model.Target;
import me.golemcore.observatory.infrastructure.config.ObservatoryProperties;
import me.golemcore.observatory.infrastructure.http.FeignClientFactory;
import me.golemcore.observatory.port.outbound.ObservabilityException;
import me.golemcore.observatory.port.outbound.ObservabilityPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import feign.Response;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link ObservabilityPort} backed by the target-planning service over HTTP.
 *
 * <p>
 * The remote service owns the celestial mechanics; this adapter only forwards
 * equatorial coordinates, site and instant, and maps the answer. Missing
 * fields in the response stay null. Any transport failure or non-2xx status
 * becomes an {@link ObservabilityException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteObservabilityAdapter implements ObservabilityPort {

    private final FeignClientFactory feignClientFactory;
    private final ObservatoryProperties properties;

    private ObservabilityApi observabilityApi;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getObservability().getBaseUrl();
        this.observabilityApi = feignClientFactory.create(ObservabilityApi.class, baseUrl,
                RemoteObservabilityAdapter::decodeError);
        log.info("[Observability] Using oracle at {}", baseUrl);
    }

    @Override
    public Observability computeObservability(Target target, ObservationQuery query) {
        Target.Coordinates coordinates = target.getCoordinates();
        if (coordinates == null) {
            log.debug("[Observability] Target {} has no coordinates", target.getId());
            return Observability.unknown();
        }

        ObservabilityResponse response;
        try {
            response = observabilityApi.compute(
                    coordinates.getRa(),
                    coordinates.getDec(),
                    query.latitude(),
                    query.longitude(),
                    query.date().toString());
        } catch (FeignException e) {
            throw new ObservabilityException(
                    "Observability oracle call failed for target " + target.getId() + ": " + e.getMessage(), e);
        }

        if (response == null) {
            return Observability.unknown();
        }
        return Observability.builder()
                .altitude(response.getAltitude())
                .airmass(response.getAirmass())
                .build();
    }

    private static Exception decodeError(String methodKey, Response response) {
        return new ObservabilityException(
                "Observability oracle returned HTTP " + response.status() + " for " + methodKey);
    }

    interface ObservabilityApi {
        @RequestLine("GET /api/v1/observability?ra={ra}&dec={dec}&latitude={lat}&longitude={lon}&date={date}")
        ObservabilityResponse compute(
                @Param("ra") double ra,
                @Param("dec") double dec,
                @Param("lat") double latitude,
                @Param("lon") double longitude,
                @Param("date") String date);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ObservabilityResponse {
        private Double altitude;
        private Double airmass;
    }
}
