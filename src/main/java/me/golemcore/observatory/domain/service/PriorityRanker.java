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
import me.golemcore.observatory.port.outbound.ObservabilityPort;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Additive priority score for a sequence. Higher scores are scheduled first.
 *
 * <ul>
 * <li>difficulty: beginner +10, intermediate +20, advanced +30</li>
 * <li>target above the minimum altitude at the start of the night: +50</li>
 * <li>airmass below the maximum at the start of the night: +30</li>
 * <li>longer than four hours: -20</li>
 * </ul>
 */
@Service
public class PriorityRanker {

    static final int BEGINNER_BONUS = 10;
    static final int INTERMEDIATE_BONUS = 20;
    static final int ADVANCED_BONUS = 30;
    static final int ALTITUDE_BONUS = 50;
    static final int AIRMASS_BONUS = 30;
    static final int LONG_SEQUENCE_PENALTY = 20;
    static final long LONG_SEQUENCE_SECONDS = Duration.ofHours(4).toSeconds();

    private final ObservabilityPort observabilityPort;

    public PriorityRanker(ObservabilityPort observabilityPort) {
        this.observabilityPort = observabilityPort;
    }

    /**
     * Score a sequence. The target is sampled once, at
     * {@link SchedulingOptions#getStartDate()}; a null target earns no
     * visibility bonus.
     */
    public int rank(Sequence sequence, Target target, SchedulingOptions options) {
        int priority = difficultyBonus(sequence);

        if (target != null) {
            Observability observability = observabilityPort.computeObservability(target,
                    ObservationQuery.of(options.getLocation(), options.getStartDate()));
            SchedulingOptions.Constraints constraints = options.getConstraints();

            Double altitude = observability.getAltitude();
            if (altitude != null && altitude > constraints.getMinAltitude()) {
                priority += ALTITUDE_BONUS;
            }
            Double airmass = observability.getAirmass();
            if (airmass != null && airmass < constraints.getMaxAirmass()) {
                priority += AIRMASS_BONUS;
            }
        }

        if (sequence.getEstimatedDuration() > LONG_SEQUENCE_SECONDS) {
            priority -= LONG_SEQUENCE_PENALTY;
        }
        return priority;
    }

    private static int difficultyBonus(Sequence sequence) {
        Sequence.Metadata metadata = sequence.getMetadata();
        if (metadata == null || metadata.getDifficulty() == null) {
            return 0;
        }
        return switch (metadata.getDifficulty()) {
        case BEGINNER -> BEGINNER_BONUS;
        case INTERMEDIATE -> INTERMEDIATE_BONUS;
        case ADVANCED -> ADVANCED_BONUS;
        };
    }
}
