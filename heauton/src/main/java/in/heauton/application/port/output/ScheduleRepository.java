package in.heauton.application.port.output;

import in.heauton.domain.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for quote delivery schedules.
 *
 * All methods throw {@link in.heauton.domain.common.PersistenceException}
 * when the store fails.
 */
public interface ScheduleRepository {

    /**
     * All schedules ordered by time of day.
     */
    List<Schedule> findAll();

    /**
     * Enabled schedules ordered by time of day.
     */
    List<Schedule> findEnabled();

    Optional<Schedule> findById(String scheduleId);

    /**
     * The schedule flagged {@code is_default}, if any.
     */
    Optional<Schedule> findDefault();

    void insert(Schedule schedule);

    /**
     * Insert the given default schedule unless a default already exists.
     *
     * @return true if this call inserted the row
     */
    boolean insertDefaultIfAbsent(Schedule schedule);

    /**
     * Replace the configurable fields of an existing schedule.
     * Delivery pointers ({@code lastDeliveredQuoteId}, {@code lastDeliveryDate}) are left alone.
     *
     * @return true if a row was updated
     */
    boolean update(Schedule schedule);

    /**
     * Set the delivery pointers only if the schedule has not been delivered
     * at or after {@code dayStart}.
     *
     * This is the compare-and-set that keeps concurrent trigger runs from
     * delivering the same schedule twice on one day.
     *
     * @param dayStart start of the calendar day of {@code deliveredAt}
     * @return true if this call claimed the day
     */
    boolean updateLastDelivery(String scheduleId, String quoteId, Instant deliveredAt, Instant dayStart);

    /**
     * @return true if a row was deleted
     */
    boolean delete(String scheduleId);

    /**
     * @return number of rows deleted
     */
    int deleteAll();

    int countAll();

    int countEnabled();

    /**
     * Latest {@code lastDeliveryDate} across all schedules.
     */
    Optional<Instant> findMostRecentDeliveryDate();
}
