package in.heauton.service.streak;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StreakCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private static Instant at(String date, int hour) {
        return LocalDate.parse(date).atTime(LocalTime.of(hour, 0)).toInstant(ZoneOffset.UTC);
    }

    @Test
    void currentStreak_emptyInputIsZero() {
        assertEquals(0, StreakCalculator.currentStreak(List.of(), UTC, LocalDate.parse("2024-03-10")));
        assertEquals(0, StreakCalculator.longestStreak(List.of(), UTC));
    }

    @Test
    void currentStreak_countsBackFromToday() {
        List<Instant> ts = List.of(at("2024-03-08", 9), at("2024-03-09", 9), at("2024-03-10", 9));

        assertEquals(3, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void currentStreak_survivesWhenLastActivityWasYesterday() {
        List<Instant> ts = List.of(at("2024-03-08", 9), at("2024-03-09", 9));

        assertEquals(2, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void currentStreak_brokenAfterTwoIdleDays() {
        List<Instant> ts = List.of(at("2024-03-07", 9), at("2024-03-08", 9));

        assertEquals(0, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void currentStreak_duplicatesOnSameDayCountOnce() {
        List<Instant> ts = List.of(at("2024-03-10", 7), at("2024-03-10", 12), at("2024-03-10", 22));

        assertEquals(1, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void currentStreak_orderOfInputDoesNotMatter() {
        List<Instant> ts = List.of(at("2024-03-10", 9), at("2024-03-08", 9), at("2024-03-09", 9));

        assertEquals(3, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void currentStreak_crossesYearBoundary() {
        List<Instant> ts = List.of(at("2023-12-30", 9), at("2023-12-31", 9), at("2024-01-01", 9));

        assertEquals(3, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-01-01")));
    }

    @Test
    void currentStreak_crossesLeapDay() {
        List<Instant> ts = List.of(at("2024-02-28", 9), at("2024-02-29", 9), at("2024-03-01", 9));

        assertEquals(3, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-01")));
    }

    @Test
    void currentStreak_usesZoneLocalDates() {
        // 23:00 UTC on the 9th is already the 10th in Tokyo
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        List<Instant> ts = List.of(at("2024-03-09", 23), at("2024-03-09", 1));

        assertEquals(2, StreakCalculator.currentStreak(ts, tokyo, LocalDate.parse("2024-03-10")));
        assertEquals(1, StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-03-10")));
    }

    @Test
    void longestStreak_findsBestRunAnywhere() {
        List<Instant> ts = List.of(
                at("2024-01-01", 9), at("2024-01-02", 9), at("2024-01-03", 9), at("2024-01-04", 9),
                at("2024-02-10", 9),
                at("2024-03-01", 9), at("2024-03-02", 9));

        assertEquals(4, StreakCalculator.longestStreak(ts, UTC));
    }

    @Test
    void longestStreak_isAtLeastCurrentStreak() {
        List<Instant> ts = new ArrayList<>();
        for (int d = 1; d <= 5; d++) {
            ts.add(at("2024-05-0" + d, 9));
        }

        int current = StreakCalculator.currentStreak(ts, UTC, LocalDate.parse("2024-05-05"));
        int longest = StreakCalculator.longestStreak(ts, UTC);

        assertEquals(5, current);
        assertEquals(5, longest);
    }

    @Test
    void dateStrings_invalidEntriesAreIgnored() {
        List<String> dates = Arrays.asList("2024-03-09", "garbage", null, "2024-02-30", "2024-03-10", "2024-3");

        assertEquals(2, StreakCalculator.currentStreakFromDateStrings(dates, UTC, LocalDate.parse("2024-03-10")));
        assertEquals(2, StreakCalculator.longestStreakFromDateStrings(dates));
    }

    @Test
    void dateStrings_allInvalidIsZero() {
        List<String> dates = List.of("not-a-date", "");

        assertEquals(0, StreakCalculator.currentStreakFromDateStrings(dates, UTC, LocalDate.parse("2024-03-10")));
        assertEquals(0, StreakCalculator.longestStreakFromDateStrings(dates));
    }

    @Test
    void uniqueDaysCount_collapsesSameDay() {
        List<Instant> ts = List.of(at("2024-03-09", 1), at("2024-03-09", 20), at("2024-03-10", 9));

        assertEquals(2, StreakCalculator.uniqueDaysCount(ts, UTC));
        assertEquals(LocalDate.parse("2024-03-09"), StreakCalculator.activityDates(ts, UTC).first());
    }
}
