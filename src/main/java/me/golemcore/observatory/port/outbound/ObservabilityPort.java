package me.golemcore.observatory.port.outbound;

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

/**
 * Port to the observability oracle that computes a target's altitude and
 * airmass for a given site and instant.
 *
 * <p>
 * Implementations must be side-effect free and callable repeatedly for the
 * same target with different dates. Unknown values are returned as null
 * fields, never as exceptions. Transport failures are raised as
 * {@link ObservabilityException} and abort the scheduling run that triggered
 * them. No timeout is imposed here; adapters apply their own.
 */
public interface ObservabilityPort {

    /**
     * Compute visibility of the target.
     *
     * @param target
     *            target to evaluate
     * @param query
     *            observer latitude/longitude and instant
     * @return altitude/airmass sample, fields may be null
     */
    Observability computeObservability(Target target, ObservationQuery query);
}
