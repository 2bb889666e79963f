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
import me.golemcore.observatory.domain.model.SchedulingOptions;
import me.golemcore.observatory.domain.model.SchedulingResult;
import me.golemcore.observatory.domain.model.Sequence;
import me.golemcore.observatory.domain.model.Target;
import me.golemcore.observatory.domain.model.TimeSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Greedy single-timeline scheduler.
 *
 * <p>
 * Sequences are ranked by {@link PriorityRanker} and placed in that order. A
 * cursor starts at the beginning of the night; each placed sequence moves it
 * to the end of its slot, so later sequences can only start after earlier ones
 * finish. A sequence that cannot be placed leaves the cursor where it was and
 * is reported as a conflict. The result is deterministic for a deterministic
 * oracle.
 *
 * <p>
 * Only oracle failures escape this class; everything that goes wrong with an
 * individual sequence is reported in the {@link SchedulingResult}.
 */
@Service
@Slf4j
public class SchedulingOrchestrator {

    private final PriorityRanker priorityRanker;
    private final TimeSlotFinder timeSlotFinder;
    private final ConflictDetector conflictDetector;

    public SchedulingOrchestrator(PriorityRanker priorityRanker, TimeSlotFinder timeSlotFinder,
            ConflictDetector conflictDetector) {
        this.priorityRanker = priorityRanker;
        this.timeSlotFinder = timeSlotFinder;
        this.conflictDetector = conflictDetector;
    }

    public SchedulingResult scheduleSequences(List<Sequence> sequences, List<Target> targets,
            SchedulingOptions options) {
        validateOptions(options);

        List<String> warnings = new ArrayList<>();
        List<SchedulingConflict> conflicts = new ArrayList<>();
        List<ScheduledSequence> scheduledSequences = new ArrayList<>();

        List<RankedSequence> ranked = rankSequences(sequences, indexTargets(targets), options, warnings);

        Instant currentTime = options.getStartDate();
        Instant endTime = options.getEndDate();

        for (RankedSequence candidate : ranked) {
            Sequence sequence = candidate.sequence();
            Optional<TimeSlot> slot = timeSlotFinder.findSlot(sequence, candidate.target(), currentTime, endTime,
                    options);

            if (slot.isPresent()) {
                scheduledSequences.add(toScheduledSequence(candidate, slot.get(), options));
                currentTime = slot.get().end();
            } else {
                conflicts.add(SchedulingConflict.builder()
                        .type(SchedulingConflict.ConflictType.TARGET_VISIBILITY)
                        .sequence(sequence.getId())
                        .description("No suitable time slot found for " + sequence.getName())
                        .severity(SchedulingConflict.Severity.MEDIUM)
                        .suggestion("Adjust time constraints")
                        .suggestion("Lower altitude requirements")
                        .build());
            }
        }

        conflicts.addAll(conflictDetector.detect(scheduledSequences));

        SchedulingResult.Statistics statistics = computeStatistics(scheduledSequences, options);
        boolean success = conflicts.stream()
                .noneMatch(conflict -> conflict.getSeverity() == SchedulingConflict.Severity.HIGH);

        log.info("[Scheduler] Placed {}/{} sequences, {} conflicts, {} warnings, utilization {}",
                scheduledSequences.size(), sequences.size(), conflicts.size(), warnings.size(),
                String.format("%.2f", statistics.getUtilizationRate()));

        return SchedulingResult.builder()
                .success(success)
                .scheduledSequences(scheduledSequences)
                .conflicts(conflicts)
                .warnings(warnings)
                .statistics(statistics)
                .build();
    }

    private List<RankedSequence> rankSequences(List<Sequence> sequences, Map<String, Target> targetsById,
            SchedulingOptions options, List<String> warnings) {
        List<RankedSequence> ranked = new ArrayList<>();
        for (Sequence sequence : sequences) {
            Target target = targetsById.get(sequence.getTarget());
            if (target == null) {
                log.warn("[Scheduler] Target {} not found for sequence {}", sequence.getTarget(), sequence.getId());
                warnings.add("Target not found for sequence " + sequence.getName());
                continue;
            }
            if (sequence.getEstimatedDuration() <= 0) {
                log.warn("[Scheduler] Sequence {} has non-positive duration {}", sequence.getId(),
                        sequence.getEstimatedDuration());
                warnings.add("Invalid duration for sequence " + sequence.getName());
                continue;
            }
            ranked.add(new RankedSequence(sequence, target, priorityRanker.rank(sequence, target, options)));
        }
        // List.sort is stable: equal scores keep input order
        ranked.sort(Comparator.comparingInt(RankedSequence::priority).reversed());
        return ranked;
    }

    private static Map<String, Target> indexTargets(List<Target> targets) {
        Map<String, Target> targetsById = new LinkedHashMap<>();
        for (Target target : targets) {
            targetsById.putIfAbsent(target.getId(), target);
        }
        return targetsById;
    }

    private static ScheduledSequence toScheduledSequence(RankedSequence candidate, TimeSlot slot,
            SchedulingOptions options) {
        Sequence sequence = candidate.sequence();
        Sequence.Metadata metadata = sequence.getMetadata();
        List<String> equipment = metadata != null && metadata.getEquipment() != null
                ? new ArrayList<>(metadata.getEquipment())
                : new ArrayList<>();

        return ScheduledSequence.builder()
                .id("scheduled-" + UUID.randomUUID().toString().substring(0, 8))
                .sequenceId(sequence.getId())
                .targetId(candidate.target().getId())
                .scheduledStart(slot.start())
                .scheduledEnd(slot.end())
                .status(ScheduledSequence.Status.PENDING)
                .priority(candidate.priority())
                .metadata(ScheduledSequence.Metadata.builder()
                        .estimatedDuration(sequence.getEstimatedDuration())
                        .weatherRequirements(new ArrayList<>(options.getConstraints().getWeatherRequirements()))
                        .equipmentRequirements(equipment)
                        .notes(metadata != null ? metadata.getNotes() : null)
                        .build())
                .build();
    }

    private static SchedulingResult.Statistics computeStatistics(List<ScheduledSequence> scheduledSequences,
            SchedulingOptions options) {
        long totalTime = scheduledSequences.stream()
                .mapToLong(s -> s.getMetadata().getEstimatedDuration())
                .sum();
        long availableTime = Duration.between(options.getStartDate(), options.getEndDate()).toSeconds();
        double utilizationRate = availableTime > 0 ? (double) totalTime / availableTime : 0.0;
        int targetCount = (int) scheduledSequences.stream()
                .map(ScheduledSequence::getTargetId)
                .distinct()
                .count();

        return SchedulingResult.Statistics.builder()
                .totalTime(totalTime)
                .utilizationRate(utilizationRate)
                .sequenceCount(scheduledSequences.size())
                .targetCount(targetCount)
                .build();
    }

    private static void validateOptions(SchedulingOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Scheduling options are required");
        }
        if (options.getStartDate() == null || options.getEndDate() == null) {
            throw new IllegalArgumentException("Scheduling window requires start and end dates");
        }
        if (!options.getEndDate().isAfter(options.getStartDate())) {
            throw new IllegalArgumentException("Scheduling window end " + options.getEndDate()
                    + " must be after start " + options.getStartDate());
        }
        if (options.getLocation() == null) {
            throw new IllegalArgumentException("Observer location is required");
        }
        if (options.getConstraints() == null) {
            throw new IllegalArgumentException("Scheduling constraints are required");
        }
    }

    private record RankedSequence(Sequence sequence, Target target, int priority) {
    }
}
