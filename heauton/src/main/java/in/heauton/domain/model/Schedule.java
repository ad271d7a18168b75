package in.heauton.domain.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Quote delivery schedule.
 *
 * Describes when (local time of day, active weekdays) and how (notification,
 * widget or both) a quote is delivered, plus the filters and the recency
 * window the quote is picked with.
 *
 * Empty {@code categories} means no category filter; empty {@code activeDays}
 * means every day of the week.
 */
public record Schedule(
        String id,
        boolean isEnabled,
        int scheduledHour,
        int scheduledMinute,
        DeliveryMethod deliveryMethod,
        boolean favoritesOnly,
        Set<String> categories,
        int excludeRecentDays,
        Set<DayOfWeek> activeDays,
        String lastDeliveredQuoteId,
        Instant lastDeliveryDate,
        boolean isDefault,
        Instant createdAt,
        Instant updatedAt) {

    public static final int DEFAULT_HOUR = 9;
    public static final int DEFAULT_MINUTE = 0;
    public static final int DEFAULT_EXCLUDE_RECENT_DAYS = 7;

    public Schedule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Schedule id cannot be blank");
        }
        deliveryMethod = deliveryMethod == null ? DeliveryMethod.BOTH : deliveryMethod;
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        activeDays = activeDays == null ? Set.of() : Set.copyOf(activeDays);
    }

    /**
     * Default schedule: enabled, 09:00 every day, notification and widget, no filters.
     */
    public static Schedule createDefault(Instant now) {
        return new Schedule(
                UUID.randomUUID().toString(),
                true,
                DEFAULT_HOUR,
                DEFAULT_MINUTE,
                DeliveryMethod.BOTH,
                false,
                Set.of(),
                DEFAULT_EXCLUDE_RECENT_DAYS,
                Set.of(),
                null,
                null,
                true,
                now,
                now);
    }

    /**
     * Check field ranges.
     *
     * @return description of the first violation, or empty when valid
     */
    public Optional<String> validationError() {
        if (scheduledHour < 0 || scheduledHour > 23) {
            return Optional.of("scheduledHour must be in 0..23, was " + scheduledHour);
        }
        if (scheduledMinute < 0 || scheduledMinute > 59) {
            return Optional.of("scheduledMinute must be in 0..59, was " + scheduledMinute);
        }
        if (excludeRecentDays < 0) {
            return Optional.of("excludeRecentDays must be >= 0, was " + excludeRecentDays);
        }
        return Optional.empty();
    }

    public LocalTime scheduledTime() {
        return LocalTime.of(scheduledHour, scheduledMinute);
    }

    /**
     * An empty {@code activeDays} set means every day.
     */
    public boolean isActiveOn(DayOfWeek day) {
        return activeDays.isEmpty() || activeDays.contains(day);
    }

    public Schedule withEnabled(boolean enabled, Instant now) {
        return new Schedule(id, enabled, scheduledHour, scheduledMinute, deliveryMethod, favoritesOnly,
                categories, excludeRecentDays, activeDays, lastDeliveredQuoteId, lastDeliveryDate,
                isDefault, createdAt, now);
    }

    public Schedule withTime(int hour, int minute, Instant now) {
        return new Schedule(id, isEnabled, hour, minute, deliveryMethod, favoritesOnly,
                categories, excludeRecentDays, activeDays, lastDeliveredQuoteId, lastDeliveryDate,
                isDefault, createdAt, now);
    }

    public Schedule withDeliveryMethod(DeliveryMethod method, Instant now) {
        return new Schedule(id, isEnabled, scheduledHour, scheduledMinute, method, favoritesOnly,
                categories, excludeRecentDays, activeDays, lastDeliveredQuoteId, lastDeliveryDate,
                isDefault, createdAt, now);
    }

    public Schedule withLastDelivery(String quoteId, Instant deliveredAt) {
        return new Schedule(id, isEnabled, scheduledHour, scheduledMinute, deliveryMethod, favoritesOnly,
                categories, excludeRecentDays, activeDays, quoteId, deliveredAt,
                isDefault, createdAt, deliveredAt);
    }
}
