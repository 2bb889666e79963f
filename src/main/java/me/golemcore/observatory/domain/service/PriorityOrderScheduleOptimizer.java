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

import me.golemcore.observatory.domain.component.ScheduleOptimizer;
import me.golemcore.observatory.domain.model.ScheduledSequence;
import me.golemcore.observatory.domain.model.SchedulingOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Default {@link ScheduleOptimizer}: orders entries by descending priority and
 * leaves their time slots untouched. It does not reflow the timeline.
 */
@Component
public class PriorityOrderScheduleOptimizer implements ScheduleOptimizer {

    @Override
    public List<ScheduledSequence> optimize(List<ScheduledSequence> scheduledSequences, SchedulingOptions options) {
        List<ScheduledSequence> ordered = new ArrayList<>(scheduledSequences);
        ordered.sort(Comparator.comparingInt(ScheduledSequence::getPriority).reversed());
        return ordered;
    }
}
