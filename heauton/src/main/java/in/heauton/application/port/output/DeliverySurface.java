package in.heauton.application.port.output;

import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.Quote;

/**
 * Where a selected quote is pushed after its delivery has been recorded
 * (system notification, home-screen widget).
 *
 * Implementations may throw; callers log the failure and do not treat it
 * as a scheduling failure.
 */
public interface DeliverySurface {

    void deliver(Quote quote, String scheduleId, DeliveryMethod method);
}
