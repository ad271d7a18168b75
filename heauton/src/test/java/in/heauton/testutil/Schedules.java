package in.heauton.testutil;

import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.Schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * Schedule fixtures.
 */
public final class Schedules {

    private Schedules() {
    }

    public static Schedule at(String id, int hour, int minute) {
        return new Schedule(id, true, hour, minute, DeliveryMethod.BOTH, false, Set.of(), 0, Set.of(),
                null, null, false, Instant.EPOCH, Instant.EPOCH);
    }

    public static Schedule withExclusion(String id, int excludeRecentDays, String lastQuoteId) {
        return new Schedule(id, true, 9, 0, DeliveryMethod.BOTH, false, Set.of(), excludeRecentDays, Set.of(),
                lastQuoteId, null, false, Instant.EPOCH, Instant.EPOCH);
    }

    public static Schedule filtered(String id, boolean favoritesOnly, Set<String> categories) {
        return new Schedule(id, true, 9, 0, DeliveryMethod.BOTH, favoritesOnly, categories, 0, Set.of(),
                null, null, false, Instant.EPOCH, Instant.EPOCH);
    }

    public static Schedule onDays(String id, int hour, int minute, Set<DayOfWeek> days) {
        return new Schedule(id, true, hour, minute, DeliveryMethod.BOTH, false, Set.of(), 0, days,
                null, null, false, Instant.EPOCH, Instant.EPOCH);
    }

    public static Schedule delivered(Schedule schedule, String quoteId, Instant at) {
        return schedule.withLastDelivery(quoteId, at);
    }

    public static Schedule disabled(Schedule schedule) {
        return schedule.withEnabled(false, schedule.updatedAt());
    }
}
