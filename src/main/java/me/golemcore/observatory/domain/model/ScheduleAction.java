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
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Action carried by a {@link ScheduleRule}. The scheduler stores actions but
 * never executes them; execution belongs to the sequencer runtime.
 */
@Value
@Builder
public class ScheduleAction {

    String id;
    ActionType type;

    @Singular
    Map<String, Object> parameters;

    /**
     * Delay before the action fires, in seconds.
     */
    Integer delay;

    public enum ActionType {
        START_SEQUENCE, PAUSE_SEQUENCE, STOP_SEQUENCE, CHANGE_TARGET, NOTIFY, CUSTOM
    }
}
