package in.heauton.service.streak;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Consecutive-day streaks over activity timestamps.
 *
 * All arithmetic is on zone-local calendar dates, so month ends, year ends
 * and leap days need no special handling.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    /**
     * Length of the run of consecutive active days ending at the most recent
     * activity, or 0 when that activity is more than one day before today.
     */
    public static int currentStreak(Collection<Instant> timestamps, ZoneId zone) {
        return currentStreak(timestamps, zone, LocalDate.now(zone));
    }

    public static int currentStreak(Collection<Instant> timestamps, ZoneId zone, LocalDate today) {
        return currentStreakOf(activityDates(timestamps, zone), today);
    }

    public static int longestStreak(Collection<Instant> timestamps, ZoneId zone) {
        return longestStreakOf(activityDates(timestamps, zone));
    }

    /**
     * Current streak over {@code YYYY-MM-DD} strings. Entries that do not
     * parse are ignored.
     */
    public static int currentStreakFromDateStrings(Collection<String> dates, ZoneId zone) {
        return currentStreakFromDateStrings(dates, zone, LocalDate.now(zone));
    }

    public static int currentStreakFromDateStrings(Collection<String> dates, ZoneId zone, LocalDate today) {
        return currentStreakOf(parseDates(dates), today);
    }

    public static int longestStreakFromDateStrings(Collection<String> dates) {
        return longestStreakOf(parseDates(dates));
    }

    public static LocalDate toLocalDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    public static int uniqueDaysCount(Collection<Instant> timestamps, ZoneId zone) {
        return activityDates(timestamps, zone).size();
    }

    /**
     * Distinct zone-local dates with at least one timestamp, ascending.
     */
    public static SortedSet<LocalDate> activityDates(Collection<Instant> timestamps, ZoneId zone) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (timestamps == null) {
            return dates;
        }
        for (Instant ts : timestamps) {
            if (ts != null) {
                dates.add(toLocalDate(ts, zone));
            }
        }
        return dates;
    }

    private static int currentStreakOf(SortedSet<LocalDate> dates, LocalDate today) {
        if (dates.isEmpty()) {
            return 0;
        }

        List<LocalDate> newestFirst = new ArrayList<>(dates);
        Collections.reverse(newestFirst);

        LocalDate mostRecent = newestFirst.get(0);
        if (ChronoUnit.DAYS.between(mostRecent, today) > 1) {
            return 0;
        }

        int streak = 1;
        LocalDate expected = mostRecent.minusDays(1);
        for (int i = 1; i < newestFirst.size(); i++) {
            if (!newestFirst.get(i).equals(expected)) {
                break;
            }
            streak++;
            expected = expected.minusDays(1);
        }
        return streak;
    }

    private static int longestStreakOf(SortedSet<LocalDate> dates) {
        if (dates.isEmpty()) {
            return 0;
        }

        int longest = 1;
        int run = 1;
        LocalDate previous = null;
        for (LocalDate date : dates) {
            if (previous != null) {
                if (ChronoUnit.DAYS.between(previous, date) == 1) {
                    run++;
                    longest = Math.max(longest, run);
                } else {
                    run = 1;
                }
            }
            previous = date;
        }
        return longest;
    }

    private static SortedSet<LocalDate> parseDates(Collection<String> values) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (values == null) {
            return dates;
        }
        values.stream()
                .filter(Objects::nonNull)
                .map(StreakCalculator::parseDate)
                .filter(Objects::nonNull)
                .forEach(dates::add);
        return dates;
    }

    private static LocalDate parseDate(String value) {
        String[] parts = value.trim().split("-");
        if (parts.length != 3) {
            return null;
        }
        try {
            return LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }
}
