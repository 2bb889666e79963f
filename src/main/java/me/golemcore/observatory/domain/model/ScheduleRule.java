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
 * A named set of conditions and actions kept in the rule store. The rule
 * fires when it is enabled and all of its conditions hold.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRule {

    private String id;
    private String name;

    @Builder.Default
    private RuleType type = RuleType.CONDITION;

    @Builder.Default
    private List<ScheduleCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<ScheduleAction> actions = new ArrayList<>();

    private int priority;

    @Builder.Default
    private boolean enabled = true;

    private Instant created;
    private Instant modified;

    public enum RuleType {
        TIME, CONDITION, EVENT
    }
}
