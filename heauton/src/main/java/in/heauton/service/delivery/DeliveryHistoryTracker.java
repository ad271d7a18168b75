package in.heauton.service.delivery;

import in.heauton.application.port.output.DeliveryRecordRepository;
import in.heauton.application.port.output.ScheduleRepository;
import in.heauton.domain.common.ErrorKind;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.DeliveryRecord;
import in.heauton.infrastructure.metrics.DeliveryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Records fulfilled deliveries.
 *
 * Recording a delivery appends a history row, prunes rows past the retention
 * window and then moves the schedule's delivery pointers. The pointer move
 * only succeeds if the schedule has not delivered earlier on the same
 * calendar day; when it loses, the appended row is removed again and the
 * call fails with {@link ErrorKind#ALREADY_DELIVERED}.
 */
public final class DeliveryHistoryTracker {
    private static final Logger log = LoggerFactory.getLogger(DeliveryHistoryTracker.class);

    private final DeliveryRecordRepository recordRepo;
    private final ScheduleRepository scheduleRepo;
    private final ZoneId zone;
    private final Duration retention;
    private final DeliveryMetrics metrics;

    public DeliveryHistoryTracker(DeliveryRecordRepository recordRepo, ScheduleRepository scheduleRepo,
                                  ZoneId zone, int retentionDays, DeliveryMetrics metrics) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be >= 1, was " + retentionDays);
        }
        this.recordRepo = recordRepo;
        this.scheduleRepo = scheduleRepo;
        this.zone = zone;
        this.retention = Duration.ofDays(retentionDays);
        this.metrics = metrics;
    }

    public Result<Void> recordDelivery(String scheduleId, String quoteId, Instant now) {
        DeliveryRecord record;
        try {
            record = recordRepo.insert(scheduleId, quoteId, now);
        } catch (RuntimeException e) {
            log.error("Failed to record delivery of {} for schedule {}: {}", quoteId, scheduleId, e.getMessage());
            return Result.persistenceFailure("Failed to record delivery", e);
        }

        pruneHistory(now);

        Instant dayStart = now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
        boolean claimed;
        try {
            claimed = scheduleRepo.updateLastDelivery(scheduleId, quoteId, now, dayStart);
        } catch (RuntimeException e) {
            log.error("Failed to update last delivery of schedule {}: {}", scheduleId, e.getMessage());
            removeRecord(record);
            return Result.persistenceFailure("Failed to update last delivery of schedule " + scheduleId, e);
        }

        if (!claimed) {
            log.warn("Schedule {} already delivered today, discarding record #{}", scheduleId, record.recordId());
            removeRecord(record);
            return Result.failure(ErrorKind.ALREADY_DELIVERED,
                    "Schedule " + scheduleId + " already delivered on " + dayStart.atZone(zone).toLocalDate());
        }

        log.info("Delivered quote {} for schedule {}", quoteId, scheduleId);
        return Result.ok();
    }

    /**
     * Remove history rows older than the retention window. Failures are
     * logged and reported as zero rows.
     *
     * @return number of rows removed
     */
    public int pruneHistory(Instant now) {
        try {
            int removed = recordRepo.deleteOlderThan(now.minus(retention));
            if (removed > 0) {
                log.debug("Pruned {} delivery record(s)", removed);
                metrics.recordPruned(removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Failed to prune delivery history: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Records of one schedule inside its recency window, newest first.
     */
    public Result<List<DeliveryRecord>> recentDeliveries(String scheduleId, Instant since) {
        try {
            return Result.success(recordRepo.findByScheduleSince(scheduleId, since));
        } catch (RuntimeException e) {
            log.error("Failed to load delivery history of schedule {}: {}", scheduleId, e.getMessage());
            return Result.persistenceFailure("Failed to load delivery history", e);
        }
    }

    private void removeRecord(DeliveryRecord record) {
        try {
            recordRepo.deleteById(record.recordId());
        } catch (RuntimeException e) {
            log.warn("Failed to remove delivery record #{}: {}", record.recordId(), e.getMessage());
        }
    }
}
