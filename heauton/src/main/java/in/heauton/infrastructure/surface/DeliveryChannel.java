package in.heauton.infrastructure.surface;

import in.heauton.domain.model.Quote;

/**
 * One outbound channel (notification or widget) a quote can be pushed to.
 */
public interface DeliveryChannel {

    /**
     * Channel name used in logs and metrics.
     */
    String name();

    void push(Quote quote, String scheduleId) throws Exception;
}
