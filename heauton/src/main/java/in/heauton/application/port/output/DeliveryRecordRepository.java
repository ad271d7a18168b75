package in.heauton.application.port.output;

import in.heauton.domain.model.DeliveryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Persistence port for the append-only delivery history.
 */
public interface DeliveryRecordRepository {

    /**
     * Append a record.
     *
     * @return the stored record with its generated id
     */
    DeliveryRecord insert(String scheduleId, String quoteId, Instant deliveredAt);

    /**
     * Records of one schedule delivered at or after {@code since}, newest first.
     */
    List<DeliveryRecord> findByScheduleSince(String scheduleId, Instant since);

    /**
     * Delete every record delivered strictly before {@code cutoff}.
     *
     * @return number of rows deleted
     */
    int deleteOlderThan(Instant cutoff);

    /**
     * @return true if a row was deleted
     */
    boolean deleteById(long recordId);
}
