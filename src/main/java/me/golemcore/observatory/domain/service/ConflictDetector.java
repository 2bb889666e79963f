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

import me.golemcore.observatory.domain.model.ScheduledSequence;
import me.golemcore.observatory.domain.model.SchedulingConflict;
import me.golemcore.observatory.domain.model.TimeSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairwise overlap check over a produced schedule.
 *
 * <p>
 * The orchestrator places sequences on a single forward-moving timeline, so
 * overlaps are not expected. Any overlap found here means that invariant was
 * broken and is reported as a {@link SchedulingConflict.Severity#HIGH}
 * conflict, which fails the run.
 */
@Service
@Slf4j
public class ConflictDetector {

    public List<SchedulingConflict> detect(List<ScheduledSequence> scheduledSequences) {
        List<SchedulingConflict> conflicts = new ArrayList<>();

        for (int i = 0; i < scheduledSequences.size(); i++) {
            for (int j = i + 1; j < scheduledSequences.size(); j++) {
                ScheduledSequence first = scheduledSequences.get(i);
                ScheduledSequence second = scheduledSequences.get(j);
                if (overlaps(first, second)) {
                    log.warn("[Scheduler] Overlap between {} and {}", first.getSequenceId(), second.getSequenceId());
                    conflicts.add(SchedulingConflict.builder()
                            .type(SchedulingConflict.ConflictType.TIME_OVERLAP)
                            .sequence(first.getSequenceId())
                            .sequence(second.getSequenceId())
                            .description("Sequences have overlapping time slots")
                            .severity(SchedulingConflict.Severity.HIGH)
                            .suggestion("Adjust sequence timing")
                            .suggestion("Reduce sequence duration")
                            .build());
                }
            }
        }

        return conflicts;
    }

    private static boolean overlaps(ScheduledSequence first, ScheduledSequence second) {
        if (first.getScheduledStart() == null || first.getScheduledEnd() == null
                || second.getScheduledStart() == null || second.getScheduledEnd() == null) {
            return false;
        }
        TimeSlot a = new TimeSlot(first.getScheduledStart(), first.getScheduledEnd());
        TimeSlot b = new TimeSlot(second.getScheduledStart(), second.getScheduledEnd());
        return a.overlaps(b);
    }
}
