package me.golemcore.observatory.domain.service;

import me.golemcore.observatory.domain.model.Observability;
import me.golemcore.observatory.domain.model.SchedulingOptions;
import me.golemcore.observatory.domain.model.Sequence;
import me.golemcore.observatory.domain.model.Target;
import me.golemcore.observatory.domain.model.TimeSlot;
import me.golemcore.observatory.infrastructure.config.ObservatoryProperties;
import me.golemcore.observatory.port.outbound.ObservabilityPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeSlotFinderTest {

    private static final Instant START = Instant.parse("2024-01-01T20:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T06:00:00Z");
    private static final Instant RISES_AT = Instant.parse("2024-01-01T23:00:00Z");
    private static final Target NGC7000 = Target.builder()
            .id("ngc7000")
            .name("North America Nebula")
            .coordinates(new Target.Coordinates(20.98, 44.33))
            .build();

    private final List<Instant> sampledAt = new ArrayList<>();
    private ObservatoryProperties properties;
    private SchedulingOptions options;

    @BeforeEach
    void setUp() {
        properties = new ObservatoryProperties();
        options = SchedulingOptions.builder()
                .startDate(START)
                .endDate(END)
                .location(new SchedulingOptions.Location(52.0, 4.0))
                .constraints(SchedulingOptions.Constraints.builder()
                        .minAltitude(30.0)
                        .maxAirmass(2.0)
                        .build())
                .build();
    }

    @Test
    void shouldAcceptFirstWindowWhenTargetIsUp() {
        TimeSlotFinder finder = new TimeSlotFinder(recording(constant(60.0, 1.2)), properties);

        Optional<TimeSlot> slot = finder.findSlot(sequence(3600), NGC7000, START, END, options);

        assertTrue(slot.isPresent());
        assertEquals(START, slot.get().start());
        assertEquals(START.plusSeconds(3600), slot.get().end());
        assertEquals(List.of(START.plusSeconds(1800)), sampledAt);
    }

    @Test
    void shouldAdvanceInFifteenMinuteStepsUntilMidpointIsVisible() {
        TimeSlotFinder finder = new TimeSlotFinder(recording(risingAt(RISES_AT)), properties);

        Optional<TimeSlot> slot = finder.findSlot(sequence(3600), NGC7000, START, END, options);

        // midpoint of [22:30, 23:30] is the rise time
        assertEquals(Instant.parse("2024-01-01T22:30:00Z"), slot.orElseThrow().start());
        assertEquals(11, sampledAt.size());
        for (int i = 1; i < sampledAt.size(); i++) {
            assertEquals(Duration.ofMinutes(15), Duration.between(sampledAt.get(i - 1), sampledAt.get(i)));
        }
    }

    @Test
    void shouldRequireWholeWindowWithEndpointSampling() {
        properties.getScheduler().setVisibilitySampling(ObservatoryProperties.VisibilitySampling.ENDPOINTS);
        TimeSlotFinder finder = new TimeSlotFinder(risingAt(RISES_AT), properties);

        Optional<TimeSlot> slot = finder.findSlot(sequence(3600), NGC7000, START, END, options);

        assertEquals(RISES_AT, slot.orElseThrow().start());
    }

    @Test
    void shouldUseConfiguredIncrement() {
        properties.getScheduler().setSlotIncrement(Duration.ofMinutes(40));
        TimeSlotFinder finder = new TimeSlotFinder(risingAt(RISES_AT), properties);

        Optional<TimeSlot> slot = finder.findSlot(sequence(3600), NGC7000, START, END, options);

        // candidates start at 20:00, 20:40, 21:20, 22:00, 22:40; midpoint 23:10 is the first visible one
        assertEquals(Instant.parse("2024-01-01T22:40:00Z"), slot.orElseThrow().start());
    }

    @Test
    void shouldFailWhenTargetNeverRises() {
        TimeSlotFinder finder = new TimeSlotFinder(constant(10.0, 5.8), properties);

        assertFalse(finder.findSlot(sequence(3600), NGC7000, START, END, options).isPresent());
    }

    @Test
    void shouldRejectHighAirmassEvenAboveMinimumAltitude() {
        TimeSlotFinder finder = new TimeSlotFinder(constant(45.0, 2.5), properties);

        assertFalse(finder.findSlot(sequence(3600), NGC7000, START, END, options).isPresent());
    }

    @Test
    void shouldTreatUnknownVisibilityAsNotObservable() {
        TimeSlotFinder finder = new TimeSlotFinder((target, query) -> Observability.builder().altitude(70.0).build(),
                properties);

        assertFalse(finder.findSlot(sequence(3600), NGC7000, START, END, options).isPresent());
    }

    @Test
    void shouldAcceptBoundaryValues() {
        TimeSlotFinder finder = new TimeSlotFinder(constant(30.0, 2.0), properties);

        assertTrue(finder.findSlot(sequence(3600), NGC7000, START, END, options).isPresent());
    }

    @Test
    void shouldAllowWindowEndingExactlyAtSearchEnd() {
        TimeSlotFinder finder = new TimeSlotFinder(constant(60.0, 1.1), properties);
        long wholeNight = Duration.between(START, END).toSeconds();

        Optional<TimeSlot> slot = finder.findSlot(sequence(wholeNight), NGC7000, START, END, options);

        assertEquals(END, slot.orElseThrow().end());
    }

    @Test
    void shouldNotSampleWhenSequenceDoesNotFit() {
        TimeSlotFinder finder = new TimeSlotFinder(recording(constant(60.0, 1.1)), properties);
        long tooLong = Duration.between(START, END).toSeconds() + 1;

        assertFalse(finder.findSlot(sequence(tooLong), NGC7000, START, END, options).isPresent());
        assertTrue(sampledAt.isEmpty());
    }

    @Test
    void shouldReturnEmptyForDurationBeyondAnyCalendar() {
        TimeSlotFinder finder = new TimeSlotFinder(recording(constant(60.0, 1.1)), properties);

        Optional<TimeSlot> slot = assertDoesNotThrow(
                () -> finder.findSlot(sequence(Long.MAX_VALUE), NGC7000, START, END, options));

        assertFalse(slot.isPresent());
        assertTrue(sampledAt.isEmpty());
    }

    @Test
    void shouldRejectNonPositiveDuration() {
        TimeSlotFinder finder = new TimeSlotFinder(constant(60.0, 1.1), properties);

        assertThrows(IllegalArgumentException.class,
                () -> finder.findSlot(sequence(0), NGC7000, START, END, options));
    }

    private ObservabilityPort recording(ObservabilityPort delegate) {
        return (target, query) -> {
            sampledAt.add(query.date());
            return delegate.computeObservability(target, query);
        };
    }

    private static ObservabilityPort constant(double altitude, double airmass) {
        return (target, query) -> Observability.builder().altitude(altitude).airmass(airmass).build();
    }

    private static ObservabilityPort risingAt(Instant riseTime) {
        return (target, query) -> query.date().isBefore(riseTime)
                ? Observability.builder().altitude(12.0).airmass(4.8).build()
                : Observability.builder().altitude(48.0).airmass(1.35).build();
    }

    private static Sequence sequence(long duration) {
        return Sequence.builder()
                .id("seq-ngc7000")
                .name("NGC 7000 Ha")
                .target("ngc7000")
                .estimatedDuration(duration)
                .build();
    }
}
