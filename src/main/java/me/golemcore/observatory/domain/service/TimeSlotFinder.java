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

import me.golemcore.observatory.domain.model.Observability;
import me.golemcore.observatory.domain.model.ObservationQuery;
import me.golemcore.observatory.domain.model.SchedulingOptions;
import me.golemcore.observatory.domain.model.Sequence;
import me.golemcore.observatory.domain.model.Target;
import me.golemcore.observatory.domain.model.TimeSlot;
import me.golemcore.observatory.infrastructure.config.ObservatoryProperties;
import me.golemcore.observatory.port.outbound.ObservabilityPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Finds the earliest window in which a sequence's target is observable.
 *
 * <p>
 * Candidate windows {@code [t, t + duration]} start at the search start and
 * move forward by the configured slot increment until the window no longer
 * fits before the search end. A window is accepted when every sample point
 * chosen by {@link ObservatoryProperties.VisibilitySampling} has both altitude
 * and airmass within the run's constraints; the target is not checked between
 * sample points.
 */
@Service
@Slf4j
public class TimeSlotFinder {

    private final ObservabilityPort observabilityPort;
    private final ObservatoryProperties properties;

    public TimeSlotFinder(ObservabilityPort observabilityPort, ObservatoryProperties properties) {
        this.observabilityPort = observabilityPort;
        this.properties = properties;
    }

    public Optional<TimeSlot> findSlot(Sequence sequence, Target target, Instant searchStart, Instant searchEnd,
            SchedulingOptions options) {
        Duration duration = Duration.ofSeconds(sequence.getEstimatedDuration());
        Duration increment = properties.getScheduler().getSlotIncrement();
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Sequence duration must be positive: " + sequence.getId());
        }
        if (increment == null || increment.isZero() || increment.isNegative()) {
            throw new IllegalArgumentException("Slot increment must be positive: " + increment);
        }

        if (duration.compareTo(Duration.between(searchStart, searchEnd)) > 0) {
            log.debug("[Scheduler] Sequence {} ({}) is longer than the search window {} - {}",
                    sequence.getId(), duration, searchStart, searchEnd);
            return Optional.empty();
        }

        int attempts = 0;
        Instant start = searchStart;
        while (!start.plus(duration).isAfter(searchEnd)) {
            TimeSlot candidate = new TimeSlot(start, start.plus(duration));
            attempts++;
            if (isObservable(target, candidate, options)) {
                log.debug("[Scheduler] Slot for {} found at {} after {} attempts", sequence.getId(), start, attempts);
                return Optional.of(candidate);
            }
            start = start.plus(increment);
        }

        log.debug("[Scheduler] No slot for {} between {} and {} ({} attempts)",
                sequence.getId(), searchStart, searchEnd, attempts);
        return Optional.empty();
    }

    private boolean isObservable(Target target, TimeSlot slot, SchedulingOptions options) {
        for (Instant sample : samplePoints(slot)) {
            Observability observability = observabilityPort.computeObservability(target,
                    ObservationQuery.of(options.getLocation(), sample));
            if (!withinConstraints(observability, options.getConstraints())) {
                return false;
            }
        }
        return true;
    }

    private List<Instant> samplePoints(TimeSlot slot) {
        return switch (properties.getScheduler().getVisibilitySampling()) {
        case MIDPOINT -> List.of(slot.midpoint());
        case ENDPOINTS -> List.of(slot.start(), slot.midpoint(), slot.end());
        };
    }

    // Unknown altitude or airmass never counts as observable.
    private static boolean withinConstraints(Observability observability, SchedulingOptions.Constraints constraints) {
        Double altitude = observability.getAltitude();
        Double airmass = observability.getAirmass();
        return altitude != null && airmass != null
                && altitude >= constraints.getMinAltitude()
                && airmass <= constraints.getMaxAirmass();
    }
}
