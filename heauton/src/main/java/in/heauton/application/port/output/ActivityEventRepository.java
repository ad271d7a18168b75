package in.heauton.application.port.output;

import in.heauton.domain.model.ActivityEvent;

import java.time.Instant;
import java.util.List;

/**
 * Persistence port for user activity events.
 */
public interface ActivityEventRepository {

    void insert(ActivityEvent event);

    /**
     * Timestamps of matching events.
     *
     * @param eventType event type to match, or null for every type
     * @param since lower bound (inclusive), or null for all history
     */
    List<Instant> findTimestamps(String eventType, Instant since);
}
