package in.heauton.service.delivery;

import java.time.Instant;
import java.util.List;

/**
 * Per-schedule outcomes of one {@code deliverDueQuotes} run.
 */
public record DeliveryReport(
        Instant startedAt,
        List<DeliveryOutcome> outcomes) {

    public DeliveryReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(DeliveryOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public int deliveredCount() {
        return (int) count(DeliveryOutcome.Status.DELIVERED);
    }

    public int failedCount() {
        return (int) count(DeliveryOutcome.Status.FAILED);
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
