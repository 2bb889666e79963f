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

import java.util.ArrayList;
import java.util.List;

/**
 * Imaging sequence submitted for scheduling. Read-only from the scheduler's
 * point of view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sequence {

    private String id;
    private String name;

    /**
     * Id of the {@link Target} this sequence images.
     */
    private String target;

    /**
     * Estimated run time in seconds.
     */
    private long estimatedDuration;

    @Builder.Default
    private Metadata metadata = new Metadata();

    public enum Difficulty {
        BEGINNER, INTERMEDIATE, ADVANCED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private Difficulty difficulty;

        @Builder.Default
        private List<String> equipment = new ArrayList<>();

        private String notes;
    }
}
