package in.heauton.service.streak;

/**
 * Streak summary for one event type (or all events when {@code eventType} is null).
 */
public record EngagementStats(
        String eventType,
        int currentStreak,
        int longestStreak,
        int activeDays,
        int totalEvents) {
}
