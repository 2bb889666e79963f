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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks placed sequences while they execute.
 *
 * <p>
 * Allowed status transitions:
 *
 * <pre>
 * PENDING -> RUNNING | FAILED | CANCELLED
 * RUNNING -> COMPLETED | FAILED | CANCELLED
 * </pre>
 *
 * Entering RUNNING stamps {@code actualStart}; entering a terminal state stamps
 * {@code actualEnd}. Unknown ids and disallowed transitions are ignored.
 *
 * <p>
 * The tracker keeps its own copies of the entries it is given and hands out
 * copies, so status only changes through
 * {@link #updateScheduledSequenceStatus(String, ScheduledSequence.Status)}.
 */
@Service
@Slf4j
public class ScheduledSequenceTracker {

    private static final Map<ScheduledSequence.Status, Set<ScheduledSequence.Status>> TRANSITIONS = Map.of(
            ScheduledSequence.Status.PENDING, EnumSet.of(
                    ScheduledSequence.Status.RUNNING,
                    ScheduledSequence.Status.FAILED,
                    ScheduledSequence.Status.CANCELLED),
            ScheduledSequence.Status.RUNNING, EnumSet.of(
                    ScheduledSequence.Status.COMPLETED,
                    ScheduledSequence.Status.FAILED,
                    ScheduledSequence.Status.CANCELLED));

    private final Clock clock;
    private final List<ScheduledSequence> scheduledSequences = new ArrayList<>();

    public ScheduledSequenceTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register the placements of a scheduling run. A still-pending entry for a
     * sequence that appears again is superseded by the new placement; entries
     * that already started or finished are kept.
     */
    public synchronized void track(Collection<ScheduledSequence> sequences) {
        Set<String> rescheduled = new HashSet<>();
        for (ScheduledSequence sequence : sequences) {
            rescheduled.add(sequence.getSequenceId());
        }
        int before = scheduledSequences.size();
        scheduledSequences.removeIf(s -> s.getStatus() == ScheduledSequence.Status.PENDING
                && rescheduled.contains(s.getSequenceId()));
        int superseded = before - scheduledSequences.size();

        for (ScheduledSequence sequence : sequences) {
            scheduledSequences.add(copy(sequence));
        }
        log.debug("[Tracker] Tracking {} sequences ({} new, {} superseded)", scheduledSequences.size(),
                sequences.size(), superseded);
    }

    public synchronized List<ScheduledSequence> getScheduledSequences() {
        List<ScheduledSequence> copies = new ArrayList<>(scheduledSequences.size());
        for (ScheduledSequence sequence : scheduledSequences) {
            copies.add(copy(sequence));
        }
        return copies;
    }

    /**
     * The pending sequence with the earliest start that is still in the future.
     */
    public synchronized Optional<ScheduledSequence> getNextScheduledSequence() {
        Instant now = clock.instant();
        return scheduledSequences.stream()
                .filter(s -> s.getStatus() == ScheduledSequence.Status.PENDING)
                .filter(s -> s.getScheduledStart().isAfter(now))
                .min(Comparator.comparing(ScheduledSequence::getScheduledStart))
                .map(ScheduledSequenceTracker::copy);
    }

    /**
     * Move a tracked sequence to a new status.
     *
     * @return true if the transition was applied
     */
    public synchronized boolean updateScheduledSequenceStatus(String id, ScheduledSequence.Status status) {
        Optional<ScheduledSequence> found = scheduledSequences.stream()
                .filter(s -> s.getId().equals(id))
                .findFirst();
        if (found.isEmpty()) {
            log.debug("[Tracker] Status update ignored, unknown sequence: {}", id);
            return false;
        }

        ScheduledSequence sequence = found.get();
        ScheduledSequence.Status current = sequence.getStatus();
        if (!TRANSITIONS.getOrDefault(current, Set.of()).contains(status)) {
            log.warn("[Tracker] Rejected transition {} -> {} for {}", current, status, id);
            return false;
        }

        Instant now = clock.instant();
        sequence.setStatus(status);
        if (status == ScheduledSequence.Status.RUNNING) {
            sequence.setActualStart(now);
        } else if (status.isTerminal()) {
            sequence.setActualEnd(now);
        }

        log.info("[Tracker] Sequence {} {} -> {}", id, current, status);
        return true;
    }

    private static ScheduledSequence copy(ScheduledSequence sequence) {
        ScheduledSequence.Metadata metadata = sequence.getMetadata();
        return sequence.toBuilder()
                .rules(sequence.getRules() != null ? new ArrayList<>(sequence.getRules()) : new ArrayList<>())
                .conditions(sequence.getConditions() != null
                        ? new ArrayList<>(sequence.getConditions())
                        : new ArrayList<>())
                .metadata(metadata != null ? copyMetadata(metadata) : null)
                .build();
    }

    private static ScheduledSequence.Metadata copyMetadata(ScheduledSequence.Metadata metadata) {
        return metadata.toBuilder()
                .weatherRequirements(metadata.getWeatherRequirements() != null
                        ? new ArrayList<>(metadata.getWeatherRequirements())
                        : new ArrayList<>())
                .equipmentRequirements(metadata.getEquipmentRequirements() != null
                        ? new ArrayList<>(metadata.getEquipmentRequirements())
                        : new ArrayList<>())
                .build();
    }
}
