package in.heauton.service.delivery;

/**
 * Result of one schedule inside a delivery batch.
 *
 * @param quoteId delivered quote, set only for {@link Status#DELIVERED}
 * @param detail  reason for anything other than a delivery
 */
public record DeliveryOutcome(
        String scheduleId,
        Status status,
        String quoteId,
        String detail) {

    public enum Status {
        DELIVERED,
        /** Filters and recency window left nothing to deliver. */
        NO_ELIGIBLE_QUOTE,
        /** Schedule vanished, became not ready, or another run delivered it first. */
        SKIPPED,
        FAILED
    }

    public static DeliveryOutcome delivered(String scheduleId, String quoteId) {
        return new DeliveryOutcome(scheduleId, Status.DELIVERED, quoteId, null);
    }

    public static DeliveryOutcome noEligibleQuote(String scheduleId) {
        return new DeliveryOutcome(scheduleId, Status.NO_ELIGIBLE_QUOTE, null, "No eligible quote");
    }

    public static DeliveryOutcome skipped(String scheduleId, String detail) {
        return new DeliveryOutcome(scheduleId, Status.SKIPPED, null, detail);
    }

    public static DeliveryOutcome failed(String scheduleId, String detail) {
        return new DeliveryOutcome(scheduleId, Status.FAILED, null, detail);
    }
}
