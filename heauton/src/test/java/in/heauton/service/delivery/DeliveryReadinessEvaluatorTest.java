package in.heauton.service.delivery;

import in.heauton.domain.model.Schedule;
import in.heauton.testutil.Schedules;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryReadinessEvaluatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    // Sunday
    private static final Instant NOW = Instant.parse("2024-03-10T10:00:00Z");

    private final DeliveryReadinessEvaluator evaluator = new DeliveryReadinessEvaluator();

    @Test
    void readySchedules_keepsInputOrderAndDropsNotYetDue() {
        List<Schedule> schedules = List.of(
                Schedules.at("late", 11, 0),
                Schedules.at("early", 8, 30),
                Schedules.at("exact", 10, 0));

        assertEquals(List.of("early", "exact"), evaluator.readySchedules(schedules, NOW, UTC));
    }

    @Test
    void isReady_disabledNeverReady() {
        assertFalse(evaluator.isReady(Schedules.disabled(Schedules.at("s1", 8, 0)), NOW, UTC));
    }

    @Test
    void isReady_notReadyTwiceOnSameDay() {
        Schedule schedule = Schedules.delivered(Schedules.at("s1", 8, 0), "q1", Instant.parse("2024-03-10T08:00:05Z"));

        assertFalse(evaluator.isReady(schedule, NOW, UTC));
    }

    @Test
    void isReady_readyAgainNextDay() {
        Schedule schedule = Schedules.delivered(Schedules.at("s1", 8, 0), "q1", Instant.parse("2024-03-09T08:00:05Z"));

        assertTrue(evaluator.isReady(schedule, NOW, UTC));
    }

    @Test
    void isReady_sameDayIsJudgedInConfiguredZone() {
        // 02:00 UTC on the 10th is still the 9th in New York
        ZoneId newYork = ZoneId.of("America/New_York");
        Instant now = Instant.parse("2024-03-10T14:00:00Z");
        Schedule schedule = Schedules.delivered(Schedules.at("s1", 8, 0), "q1", Instant.parse("2024-03-10T02:00:00Z"));

        assertTrue(evaluator.isReady(schedule, now, newYork));
        assertFalse(evaluator.isReady(schedule, now, UTC));
    }

    @Test
    void isReady_respectsActiveDays() {
        Schedule weekdays = Schedules.onDays("s1", 8, 0,
                Set.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY));
        Schedule sundays = Schedules.onDays("s2", 8, 0, Set.of(DayOfWeek.SUNDAY));

        assertFalse(evaluator.isReady(weekdays, NOW, UTC));
        assertTrue(evaluator.isReady(sundays, NOW, UTC));
    }

    @Test
    void isReady_timeInsideDstGapShiftsForward() {
        // 2024-03-10 02:30 does not exist in New York; it becomes 03:30 EDT (07:30Z)
        ZoneId newYork = ZoneId.of("America/New_York");
        Schedule schedule = Schedules.at("s1", 2, 30);

        assertFalse(evaluator.isReady(schedule, Instant.parse("2024-03-10T07:29:00Z"), newYork));
        assertTrue(evaluator.isReady(schedule, Instant.parse("2024-03-10T07:30:00Z"), newYork));
    }

    @Test
    void nextDeliveryTime_laterTodayWhenNotYetDue() {
        Schedule schedule = Schedules.at("s1", 18, 15);

        assertEquals(Optional.of(Instant.parse("2024-03-10T18:15:00Z")),
                evaluator.nextDeliveryTime(schedule, NOW, UTC));
    }

    @Test
    void nextDeliveryTime_tomorrowWhenAlreadyDeliveredToday() {
        Schedule schedule = Schedules.delivered(Schedules.at("s1", 8, 0), "q1", Instant.parse("2024-03-10T08:00:00Z"));

        assertEquals(Optional.of(Instant.parse("2024-03-11T08:00:00Z")),
                evaluator.nextDeliveryTime(schedule, NOW, UTC));
    }

    @Test
    void nextDeliveryTime_skipsInactiveDays() {
        Schedule schedule = Schedules.onDays("s1", 7, 0, Set.of(DayOfWeek.WEDNESDAY));

        assertEquals(Optional.of(Instant.parse("2024-03-13T07:00:00Z")),
                evaluator.nextDeliveryTime(schedule, NOW, UTC));
    }

    @Test
    void nextDeliveryTime_emptyWhenDisabled() {
        assertEquals(Optional.empty(),
                evaluator.nextDeliveryTime(Schedules.disabled(Schedules.at("s1", 8, 0)), NOW, UTC));
    }
}
