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
import me.golemcore.observatory.domain.model.EvaluationContext;
import me.golemcore.observatory.domain.model.ScheduleCondition;
import me.golemcore.observatory.domain.model.ScheduleRule;
import me.golemcore.observatory.domain.model.ScheduleRuleUpdate;
import me.golemcore.observatory.domain.model.ScheduledSequence;
import me.golemcore.observatory.domain.model.SchedulingOptions;
import me.golemcore.observatory.domain.model.SchedulingResult;
import me.golemcore.observatory.domain.model.Sequence;
import me.golemcore.observatory.domain.model.Target;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Entry point used by the sequencer UI and job runner.
 *
 * <p>
 * Combines the scheduling run, the rule store and the real-time tracker.
 * Placements of every run are handed to the tracker so they can be followed
 * through execution.
 *
 * @see SchedulingOrchestrator
 * @see ScheduleRuleService
 * @see ScheduledSequenceTracker
 */
@Service
@RequiredArgsConstructor
public class ObservationSchedulerService {

    private final SchedulingOrchestrator schedulingOrchestrator;
    private final ScheduleRuleService scheduleRuleService;
    private final ScheduledSequenceTracker scheduledSequenceTracker;
    private final ConditionEvaluator conditionEvaluator;
    private final ScheduleOptimizer scheduleOptimizer;

    /**
     * Run the scheduler and start tracking the placed sequences.
     *
     * @throws me.golemcore.observatory.port.outbound.ObservabilityException
     *             if the observability oracle fails; nothing is tracked then
     */
    public SchedulingResult scheduleSequences(List<Sequence> sequences, List<Target> targets,
            SchedulingOptions options) {
        SchedulingResult result = schedulingOrchestrator.scheduleSequences(sequences, targets, options);
        scheduledSequenceTracker.track(result.getScheduledSequences());
        return result;
    }

    public List<ScheduledSequence> optimizeSchedule(List<ScheduledSequence> scheduledSequences,
            SchedulingOptions options) {
        return scheduleOptimizer.optimize(scheduledSequences, options);
    }

    // ==================== RULES ====================

    public ScheduleRule addRule(ScheduleRule rule) {
        return scheduleRuleService.addRule(rule);
    }

    public Optional<ScheduleRule> updateRule(String ruleId, ScheduleRuleUpdate update) {
        return scheduleRuleService.updateRule(ruleId, update);
    }

    public boolean deleteRule(String ruleId) {
        return scheduleRuleService.deleteRule(ruleId);
    }

    public List<ScheduleRule> getRules() {
        return scheduleRuleService.getRules();
    }

    public boolean evaluateCondition(ScheduleCondition condition, EvaluationContext context) {
        return conditionEvaluator.evaluate(condition, context);
    }

    /**
     * Stored rules that hold in the given context, highest priority first.
     */
    public List<ScheduleRule> findTriggeredRules(EvaluationContext context) {
        return scheduleRuleService.getRules().stream()
                .filter(rule -> conditionEvaluator.evaluateRule(rule, context))
                .sorted(Comparator.comparingInt(ScheduleRule::getPriority).reversed())
                .toList();
    }

    // ==================== TRACKING ====================

    public Optional<ScheduledSequence> getNextScheduledSequence() {
        return scheduledSequenceTracker.getNextScheduledSequence();
    }

    public boolean updateScheduledSequenceStatus(String id, ScheduledSequence.Status status) {
        return scheduledSequenceTracker.updateScheduledSequenceStatus(id, status);
    }
}
