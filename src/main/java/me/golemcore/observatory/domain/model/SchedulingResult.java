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
import lombok.Value;

import java.util.List;

/**
 * Outcome of one scheduling run. Callers must inspect {@link #isSuccess()} and
 * {@link #getConflicts()}; per-sequence failures are never thrown.
 */
@Value
@Builder
public class SchedulingResult {

    boolean success;
    List<ScheduledSequence> scheduledSequences;
    List<SchedulingConflict> conflicts;
    List<String> warnings;
    Statistics statistics;

    @Value
    @Builder
    public static class Statistics {

        /**
         * Sum of estimated durations of placed sequences, in seconds.
         */
        long totalTime;

        double utilizationRate;
        int sequenceCount;
        int targetCount;
    }
}
