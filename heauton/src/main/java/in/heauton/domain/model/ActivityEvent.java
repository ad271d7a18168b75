package in.heauton.domain.model;

import java.time.Instant;

/**
 * Timestamped user action counted toward engagement streaks.
 */
public record ActivityEvent(
        String eventId,
        String eventType, // quote_viewed | quote_favorited | journal_created | exercise_completed | quote_delivered
        String relatedEntityId,
        Instant occurredAt) {

    public static final String QUOTE_VIEWED = "quote_viewed";
    public static final String QUOTE_FAVORITED = "quote_favorited";
    public static final String QUOTE_DELIVERED = "quote_delivered";
    public static final String JOURNAL_CREATED = "journal_created";
    public static final String EXERCISE_COMPLETED = "exercise_completed";

    public ActivityEvent {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
