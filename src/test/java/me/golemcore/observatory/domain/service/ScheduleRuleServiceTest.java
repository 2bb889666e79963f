package me.golemcore.observatory.domain.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import me.golemcore.observatory.domain.model.ScheduleAction;
import me.golemcore.observatory.domain.model.ScheduleCondition;
import me.golemcore.observatory.domain.model.ScheduleRule;
import me.golemcore.observatory.domain.model.ScheduleRuleUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduleRuleServiceTest {

    private static final Instant T1 = Instant.parse("2024-01-01T18:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-01T18:05:00Z");
    private static final Instant T3 = Instant.parse("2024-01-01T18:10:00Z");

    private Clock clock;
    private ScheduleRuleService service;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T1, T2, T3);
        service = new ScheduleRuleService(clock);
    }

    @Test
    void shouldAssignIdAndTimestampsOnAdd() {
        ScheduleRule stored = service.addRule(rule("Clouds pause", 5));

        assertNotNull(stored.getId());
        assertTrue(stored.getId().startsWith("rule-"));
        assertEquals(T1, stored.getCreated());
        assertEquals(T1, stored.getModified());
        assertEquals("Clouds pause", stored.getName());
        assertEquals(1, stored.getConditions().size());
        assertEquals(1, stored.getActions().size());
        assertEquals(List.of(stored), service.getRules());
    }

    @Test
    void shouldReplaceCallerSuppliedIdAndTimestamps() {
        ScheduleRule input = rule("Dawn stop", 1).toBuilder()
                .id("my-own-id")
                .created(Instant.EPOCH)
                .modified(Instant.EPOCH)
                .build();

        ScheduleRule stored = service.addRule(input);

        assertNotEquals("my-own-id", stored.getId());
        assertEquals(T1, stored.getCreated());
    }

    @Test
    void shouldGenerateDistinctIds() {
        ScheduleRule first = service.addRule(rule("A", 1));
        ScheduleRule second = service.addRule(rule("B", 2));

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, service.getRules().size());
    }

    @Test
    void shouldAcceptRuleWithoutConditionsOrActions() {
        ScheduleRule stored = service.addRule(ScheduleRule.builder()
                .name("Bare")
                .conditions(null)
                .actions(null)
                .build());

        assertTrue(stored.getConditions().isEmpty());
        assertTrue(stored.getActions().isEmpty());
    }

    @Test
    void shouldApplyOnlyProvidedFieldsOnUpdate() {
        ScheduleRule stored = service.addRule(rule("Clouds pause", 5));

        Optional<ScheduleRule> updated = service.updateRule(stored.getId(), ScheduleRuleUpdate.builder()
                .enabled(false)
                .build());

        assertTrue(updated.isPresent());
        ScheduleRule rule = updated.get();
        assertFalse(rule.isEnabled());
        assertEquals("Clouds pause", rule.getName());
        assertEquals(5, rule.getPriority());
        assertEquals(ScheduleRule.RuleType.CONDITION, rule.getType());
        assertEquals(1, rule.getConditions().size());
        assertEquals(T1, rule.getCreated());
        assertEquals(T2, rule.getModified());
        assertTrue(rule.getModified().isAfter(rule.getCreated()));
    }

    @Test
    void shouldReplaceListsAndScalarsOnUpdate() {
        ScheduleRule stored = service.addRule(rule("Clouds pause", 5));

        ScheduleRule rule = service.updateRule(stored.getId(), ScheduleRuleUpdate.builder()
                .name("Clouds stop")
                .type(ScheduleRule.RuleType.EVENT)
                .priority(9)
                .conditions(List.of())
                .actions(List.of(ScheduleAction.builder().type(ScheduleAction.ActionType.NOTIFY).build()))
                .build()).orElseThrow();

        assertEquals("Clouds stop", rule.getName());
        assertEquals(ScheduleRule.RuleType.EVENT, rule.getType());
        assertEquals(9, rule.getPriority());
        assertTrue(rule.getConditions().isEmpty());
        assertEquals(ScheduleAction.ActionType.NOTIFY, rule.getActions().get(0).getType());
        assertEquals(service.getRules().get(0), rule);
    }

    @Test
    void shouldReturnEmptyWhenUpdatingUnknownRule() {
        service.addRule(rule("Clouds pause", 5));

        Optional<ScheduleRule> updated = service.updateRule("rule-missing", ScheduleRuleUpdate.builder()
                .name("x")
                .build());

        assertTrue(updated.isEmpty());
        assertEquals("Clouds pause", service.getRules().get(0).getName());
    }

    @Test
    void shouldDeleteRule() {
        ScheduleRule first = service.addRule(rule("A", 1));
        ScheduleRule second = service.addRule(rule("B", 2));

        assertTrue(service.deleteRule(first.getId()));

        assertEquals(List.of(second), service.getRules());
        assertTrue(service.findRule(first.getId()).isEmpty());
    }

    @Test
    void shouldReportFalseWhenDeletingUnknownRule() {
        service.addRule(rule("A", 1));

        assertFalse(service.deleteRule("rule-missing"));
        assertEquals(1, service.getRules().size());
    }

    @Test
    void shouldReturnCopyOfRuleList() {
        service.addRule(rule("A", 1));

        List<ScheduleRule> snapshot = service.getRules();
        snapshot.clear();

        assertEquals(1, service.getRules().size());
    }

    @Test
    void shouldNotExposeStoredRuleToCallerMutation() {
        ScheduleRule added = service.addRule(rule("Clouds pause", 5));

        added.setEnabled(false);
        added.setName("changed");
        added.getConditions().add(cloudCondition());

        ScheduleRule stored = service.getRules().get(0);
        assertTrue(stored.isEnabled());
        assertEquals("Clouds pause", stored.getName());
        assertEquals(1, stored.getConditions().size());
        assertEquals(stored.getCreated(), stored.getModified());
    }

    @Test
    void shouldReturnCopiesFromLookupsAndUpdates() {
        ScheduleRule added = service.addRule(rule("Clouds pause", 5));

        service.getRules().get(0).setPriority(99);
        service.findRule(added.getId()).orElseThrow().getActions().clear();
        ScheduleRule updated = service.updateRule(added.getId(), ScheduleRuleUpdate.builder()
                .name("Clouds stop")
                .build()).orElseThrow();
        updated.setName("changed");

        ScheduleRule stored = service.findRule(added.getId()).orElseThrow();
        assertEquals(5, stored.getPriority());
        assertEquals(1, stored.getActions().size());
        assertEquals("Clouds stop", stored.getName());
        assertEquals(T2, stored.getModified());
    }

    @Test
    void shouldNotShareCallerConditionList() {
        List<ScheduleCondition> conditions = new ArrayList<>(List.of(cloudCondition()));
        ScheduleRule stored = service.addRule(ScheduleRule.builder()
                .name("Clouds pause")
                .conditions(conditions)
                .build());

        conditions.add(cloudCondition());

        assertEquals(1, stored.getConditions().size());
    }

    private static ScheduleRule rule(String name, int priority) {
        return ScheduleRule.builder()
                .name(name)
                .priority(priority)
                .conditions(List.of(cloudCondition()))
                .actions(List.of(ScheduleAction.builder()
                        .id("act-1")
                        .type(ScheduleAction.ActionType.PAUSE_SEQUENCE)
                        .parameter("reason", "clouds")
                        .build()))
                .build();
    }

    private static ScheduleCondition cloudCondition() {
        return ScheduleCondition.builder()
                .id("cond-1")
                .type(ScheduleCondition.ConditionType.WEATHER)
                .operator(ScheduleCondition.Operator.GREATER_THAN)
                .value(JsonNodeFactory.instance.objectNode()
                        .put("parameter", "cloud_cover")
                        .put("threshold", 60))
                .build();
    }
}
