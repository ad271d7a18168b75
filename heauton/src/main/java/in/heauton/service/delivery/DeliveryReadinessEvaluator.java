package in.heauton.service.delivery;

import in.heauton.domain.model.Schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which schedules are due.
 *
 * A schedule is ready when it is enabled, active on today's weekday, its
 * time of day has passed and it has not yet delivered on today's calendar
 * date. "Today" is always taken in the configured zone.
 */
public final class DeliveryReadinessEvaluator {

    /**
     * Ids of the ready schedules, in input order.
     */
    public List<String> readySchedules(List<Schedule> schedules, Instant now, ZoneId zone) {
        List<String> ready = new ArrayList<>();
        for (Schedule schedule : schedules) {
            if (isReady(schedule, now, zone)) {
                ready.add(schedule.id());
            }
        }
        return ready;
    }

    public boolean isReady(Schedule schedule, Instant now, ZoneId zone) {
        if (!schedule.isEnabled()) {
            return false;
        }
        LocalDate today = now.atZone(zone).toLocalDate();
        if (!schedule.isActiveOn(today.getDayOfWeek())) {
            return false;
        }
        if (now.isBefore(scheduledInstant(schedule, today, zone))) {
            return false;
        }
        return !deliveredOn(schedule, today, zone);
    }

    /**
     * Next instant at or after {@code now} on which the schedule fires,
     * skipping today when it already delivered today.
     *
     * @return empty when the schedule is disabled
     */
    public Optional<Instant> nextDeliveryTime(Schedule schedule, Instant now, ZoneId zone) {
        if (!schedule.isEnabled()) {
            return Optional.empty();
        }
        LocalDate today = now.atZone(zone).toLocalDate();
        // A week ahead covers every weekday pattern
        for (int offset = 0; offset <= 7; offset++) {
            LocalDate day = today.plusDays(offset);
            if (!schedule.isActiveOn(day.getDayOfWeek())) {
                continue;
            }
            Instant candidate = scheduledInstant(schedule, day, zone);
            if (offset == 0 && (candidate.isBefore(now) || deliveredOn(schedule, today, zone))) {
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * Scheduled time of day on {@code day}. A time inside a DST gap is
     * shifted forward by the length of the gap.
     */
    static Instant scheduledInstant(Schedule schedule, LocalDate day, ZoneId zone) {
        return ZonedDateTime.of(day, schedule.scheduledTime(), zone).toInstant();
    }

    private static boolean deliveredOn(Schedule schedule, LocalDate day, ZoneId zone) {
        Instant last = schedule.lastDeliveryDate();
        return last != null && last.atZone(zone).toLocalDate().equals(day);
    }
}
