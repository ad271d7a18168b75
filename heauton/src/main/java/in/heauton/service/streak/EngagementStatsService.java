package in.heauton.service.streak;

import in.heauton.application.port.output.ActivityEventRepository;
import in.heauton.domain.common.ErrorKind;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.ActivityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Engagement streaks computed from stored activity events.
 */
public final class EngagementStatsService {
    private static final Logger log = LoggerFactory.getLogger(EngagementStatsService.class);

    private final ActivityEventRepository eventRepo;
    private final Clock clock;

    public EngagementStatsService(ActivityEventRepository eventRepo, Clock clock) {
        this.eventRepo = eventRepo;
        this.clock = clock;
    }

    public Result<ActivityEvent> recordActivity(String eventType, String relatedEntityId) {
        if (eventType == null || eventType.isBlank()) {
            return Result.failure(ErrorKind.INVALID_ARGUMENT, "eventType is required");
        }
        ActivityEvent event = new ActivityEvent(UUID.randomUUID().toString(), eventType.trim(),
                relatedEntityId, clock.instant());
        try {
            eventRepo.insert(event);
            return Result.success(event);
        } catch (RuntimeException e) {
            log.error("Failed to record {} activity: {}", eventType, e.getMessage());
            return Result.persistenceFailure("Failed to record activity", e);
        }
    }

    /**
     * @param eventType event type to count, or null for every type
     */
    public Result<EngagementStats> statsFor(String eventType) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        try {
            List<Instant> timestamps = eventRepo.findTimestamps(eventType, null);
            return Result.success(new EngagementStats(
                    eventType,
                    StreakCalculator.currentStreak(timestamps, zone, today),
                    StreakCalculator.longestStreak(timestamps, zone),
                    StreakCalculator.uniqueDaysCount(timestamps, zone),
                    timestamps.size()));
        } catch (RuntimeException e) {
            log.error("Failed to compute engagement stats for {}: {}", eventType, e.getMessage());
            return Result.persistenceFailure("Failed to compute engagement stats", e);
        }
    }
}
