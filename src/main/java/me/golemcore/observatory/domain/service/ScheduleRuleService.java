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

import me.golemcore.observatory.domain.model.ScheduleRule;
import me.golemcore.observatory.domain.model.ScheduleRuleUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory store of {@link ScheduleRule}s. All access goes through
 * synchronized methods. Every rule handed out is a copy, so stored rules only
 * change through {@link #updateRule(String, ScheduleRuleUpdate)}.
 */
@Service
@Slf4j
public class ScheduleRuleService {

    private final Clock clock;
    private final List<ScheduleRule> rules = new ArrayList<>();

    public ScheduleRuleService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Store a new rule. Any id or timestamps on the input are replaced.
     */
    public synchronized ScheduleRule addRule(ScheduleRule rule) {
        Instant now = clock.instant();
        ScheduleRule stored = rule.toBuilder()
                .id("rule-" + UUID.randomUUID().toString().substring(0, 8))
                .conditions(copyOf(rule.getConditions()))
                .actions(copyOf(rule.getActions()))
                .created(now)
                .modified(now)
                .build();
        rules.add(stored);
        log.info("[Rules] Added rule {} ({})", stored.getId(), stored.getName());
        return copy(stored);
    }

    /**
     * Apply the non-null fields of the update and stamp the modification time.
     *
     * @return the updated rule, or empty if no rule has this id
     */
    public synchronized Optional<ScheduleRule> updateRule(String ruleId, ScheduleRuleUpdate update) {
        Optional<ScheduleRule> found = findStored(ruleId);
        if (found.isEmpty()) {
            log.debug("[Rules] Update ignored, rule not found: {}", ruleId);
            return Optional.empty();
        }

        ScheduleRule rule = found.get();
        if (update.getName() != null) {
            rule.setName(update.getName());
        }
        if (update.getType() != null) {
            rule.setType(update.getType());
        }
        if (update.getConditions() != null) {
            rule.setConditions(new ArrayList<>(update.getConditions()));
        }
        if (update.getActions() != null) {
            rule.setActions(new ArrayList<>(update.getActions()));
        }
        if (update.getPriority() != null) {
            rule.setPriority(update.getPriority());
        }
        if (update.getEnabled() != null) {
            rule.setEnabled(update.getEnabled());
        }
        rule.setModified(clock.instant());

        log.info("[Rules] Updated rule {}", ruleId);
        return Optional.of(copy(rule));
    }

    /**
     * @return true if a rule was removed
     */
    public synchronized boolean deleteRule(String ruleId) {
        boolean removed = rules.removeIf(r -> r.getId().equals(ruleId));
        if (removed) {
            log.info("[Rules] Deleted rule {}", ruleId);
        }
        return removed;
    }

    public synchronized List<ScheduleRule> getRules() {
        List<ScheduleRule> copies = new ArrayList<>(rules.size());
        for (ScheduleRule rule : rules) {
            copies.add(copy(rule));
        }
        return copies;
    }

    public synchronized Optional<ScheduleRule> findRule(String ruleId) {
        return findStored(ruleId).map(ScheduleRuleService::copy);
    }

    private Optional<ScheduleRule> findStored(String ruleId) {
        return rules.stream()
                .filter(r -> r.getId().equals(ruleId))
                .findFirst();
    }

    private static ScheduleRule copy(ScheduleRule rule) {
        return rule.toBuilder()
                .conditions(copyOf(rule.getConditions()))
                .actions(copyOf(rule.getActions()))
                .build();
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }
}
