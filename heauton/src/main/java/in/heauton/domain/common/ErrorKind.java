package in.heauton.domain.common;

/**
 * Failure categories surfaced by the delivery engine.
 */
public enum ErrorKind {
    /** Schedule or quote id did not resolve. Batches treat this as a no-op. */
    NOT_FOUND,
    /** Store unavailable or statement failed. Retried on the next trigger cycle. */
    PERSISTENCE_FAILURE,
    /** Caller supplied out-of-range or missing fields. */
    INVALID_ARGUMENT,
    /** Another run already recorded today's delivery for the schedule. */
    ALREADY_DELIVERED,
    /** The notification or widget channel rejected the quote. */
    DELIVERY_FAILURE
}
