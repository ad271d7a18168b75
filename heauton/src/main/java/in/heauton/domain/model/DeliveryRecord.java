package in.heauton.domain.model;

import java.time.Instant;

/**
 * One fulfilled delivery. Append-only; used for exclusion-window lookups.
 */
public record DeliveryRecord(
        long recordId,
        String quoteId,
        String scheduleId,
        Instant deliveredAt) {
}
