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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A sequence placed on the observing timeline. Created in {@link Status#PENDING}
 * by the orchestrator; later status changes come from the real-time tracker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledSequence {

    private String id;
    private String sequenceId;
    private String targetId;
    private Instant scheduledStart;
    private Instant scheduledEnd;
    private Instant actualStart;
    private Instant actualEnd;

    @Builder.Default
    private Status status = Status.PENDING;

    private int priority;

    @Builder.Default
    private List<String> rules = new ArrayList<>();

    @Builder.Default
    private List<ScheduleCondition> conditions = new ArrayList<>();

    private Metadata metadata;

    /**
     * Execution lifecycle states.
     */
    public enum Status {
        PENDING, RUNNING, COMPLETED, FAILED, CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {

        /**
         * Seconds, copied from the source sequence.
         */
        private long estimatedDuration;

        @Builder.Default
        private List<String> weatherRequirements = new ArrayList<>();

        @Builder.Default
        private List<String> equipmentRequirements = new ArrayList<>();

        private String notes;
    }
}
