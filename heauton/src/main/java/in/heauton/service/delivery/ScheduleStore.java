package in.heauton.service.delivery;

import in.heauton.application.port.output.DeliverySurface;
import in.heauton.application.port.output.ScheduleRepository;
import in.heauton.domain.common.ErrorKind;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.DeliveryRecord;
import in.heauton.domain.model.Quote;
import in.heauton.domain.model.Schedule;
import in.heauton.infrastructure.cache.BoundedCache;
import in.heauton.infrastructure.cache.CacheRegion;
import in.heauton.infrastructure.metrics.DeliveryMetrics;
import in.heauton.service.QuoteCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Entry point for schedule management and quote delivery.
 *
 * Every operation returns a {@link Result}; store failures become
 * {@link ErrorKind#PERSISTENCE_FAILURE} results instead of exceptions.
 * Single-schedule reads go through the SCHEDULES cache region and every
 * mutation invalidates the affected entries.
 *
 * Deliveries for one schedule are serialized by a per-schedule lock held
 * for the whole read-select-record-notify sequence. The conditional pointer
 * update in {@link DeliveryHistoryTracker} covers runs in other processes.
 */
public final class ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    private final ScheduleRepository scheduleRepo;
    private final QuoteCatalog quoteCatalog;
    private final QuoteEligibilitySelector selector;
    private final DeliveryReadinessEvaluator evaluator;
    private final DeliveryHistoryTracker tracker;
    private final DeliverySurface surface;
    private final BoundedCache cache;
    private final DeliveryMetrics metrics;
    private final ZoneId zone;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> scheduleLocks = new ConcurrentHashMap<>();

    public ScheduleStore(ScheduleRepository scheduleRepo,
                         QuoteCatalog quoteCatalog,
                         QuoteEligibilitySelector selector,
                         DeliveryReadinessEvaluator evaluator,
                         DeliveryHistoryTracker tracker,
                         DeliverySurface surface,
                         BoundedCache cache,
                         DeliveryMetrics metrics,
                         Clock clock) {
        this.scheduleRepo = scheduleRepo;
        this.quoteCatalog = quoteCatalog;
        this.selector = selector;
        this.evaluator = evaluator;
        this.tracker = tracker;
        this.surface = surface;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = clock.getZone();
    }

    // ----------------------------------------------------------------------------------------------
    // Schedule management
    // ----------------------------------------------------------------------------------------------

    public Result<Schedule> createSchedule(Schedule schedule) {
        Optional<String> invalid = schedule.validationError();
        if (invalid.isPresent()) {
            return Result.failure(ErrorKind.INVALID_ARGUMENT, invalid.get());
        }
        Instant now = clock.instant();
        Schedule toInsert = new Schedule(schedule.id(), schedule.isEnabled(), schedule.scheduledHour(),
                schedule.scheduledMinute(), schedule.deliveryMethod(), schedule.favoritesOnly(),
                schedule.categories(), schedule.excludeRecentDays(), schedule.activeDays(),
                schedule.lastDeliveredQuoteId(), schedule.lastDeliveryDate(), schedule.isDefault(),
                schedule.createdAt() != null ? schedule.createdAt() : now, now);

        return guard("create schedule " + schedule.id(), () -> {
            if (toInsert.isDefault() && scheduleRepo.findDefault().isPresent()) {
                return Result.failure(ErrorKind.INVALID_ARGUMENT, "A default schedule already exists");
            }
            if (scheduleRepo.findById(toInsert.id()).isPresent()) {
                return Result.failure(ErrorKind.INVALID_ARGUMENT, "Schedule already exists: " + toInsert.id());
            }
            scheduleRepo.insert(toInsert);
            cache.remove(CacheRegion.SCHEDULES, toInsert.id());
            return Result.success(toInsert);
        });
    }

    /**
     * Replace the configurable fields of a schedule. Delivery pointers are
     * owned by the delivery path and are not touched.
     */
    public Result<Schedule> updateSchedule(Schedule schedule) {
        Optional<String> invalid = schedule.validationError();
        if (invalid.isPresent()) {
            return Result.failure(ErrorKind.INVALID_ARGUMENT, invalid.get());
        }
        Instant now = clock.instant();

        return guard("update schedule " + schedule.id(), () -> {
            Optional<Schedule> existing = scheduleRepo.findById(schedule.id());
            if (existing.isEmpty()) {
                return Result.notFound("Schedule not found: " + schedule.id());
            }
            Schedule current = existing.get();
            Schedule merged = new Schedule(current.id(), schedule.isEnabled(), schedule.scheduledHour(),
                    schedule.scheduledMinute(), schedule.deliveryMethod(), schedule.favoritesOnly(),
                    schedule.categories(), schedule.excludeRecentDays(), schedule.activeDays(),
                    current.lastDeliveredQuoteId(), current.lastDeliveryDate(), current.isDefault(),
                    current.createdAt(), now);
            boolean updated = scheduleRepo.update(merged);
            cache.remove(CacheRegion.SCHEDULES, merged.id());
            return updated ? Result.success(merged) : Result.notFound("Schedule not found: " + schedule.id());
        });
    }

    public Result<Void> deleteSchedule(String scheduleId) {
        return guard("delete schedule " + scheduleId, () -> {
            boolean deleted = scheduleRepo.delete(scheduleId);
            cache.remove(CacheRegion.SCHEDULES, scheduleId);
            scheduleLocks.remove(scheduleId);
            return deleted ? Result.ok() : Result.notFound("Schedule not found: " + scheduleId);
        });
    }

    /**
     * @return number of schedules removed
     */
    public Result<Integer> deleteAllSchedules() {
        return guard("delete all schedules", () -> {
            int deleted = scheduleRepo.deleteAll();
            cache.clear(CacheRegion.SCHEDULES);
            scheduleLocks.clear();
            return Result.success(deleted);
        });
    }

    public Result<Schedule> getSchedule(String scheduleId) {
        Optional<Schedule> cached = cache.get(CacheRegion.SCHEDULES, scheduleId);
        if (cached.isPresent()) {
            return Result.success(cached.get());
        }
        long generation = cache.generation(CacheRegion.SCHEDULES);
        return guard("load schedule " + scheduleId, () -> {
            Optional<Schedule> loaded = scheduleRepo.findById(scheduleId);
            if (loaded.isEmpty()) {
                return Result.notFound("Schedule not found: " + scheduleId);
            }
            // A mutation that ran during the load wins; its snapshot is not cached
            cache.putIfNotInvalidated(CacheRegion.SCHEDULES, scheduleId, loaded.get(), generation);
            return Result.success(loaded.get());
        });
    }

    public Result<List<Schedule>> getAllSchedules() {
        return guard("load schedules", () -> Result.success(scheduleRepo.findAll()));
    }

    public Result<List<Schedule>> getEnabledSchedules() {
        return guard("load enabled schedules", () -> Result.success(scheduleRepo.findEnabled()));
    }

    public Result<Schedule> getDefaultSchedule() {
        return guard("load default schedule", () -> scheduleRepo.findDefault()
                .map(Result::success)
                .orElseGet(() -> Result.notFound("No default schedule")));
    }

    /**
     * Return the default schedule, creating it first when none exists.
     * Safe to call concurrently: exactly one default is ever stored.
     */
    public Result<Schedule> ensureDefaultSchedule() {
        return guard("ensure default schedule", () -> {
            Optional<Schedule> existing = scheduleRepo.findDefault();
            if (existing.isPresent()) {
                return Result.success(existing.get());
            }
            Schedule candidate = Schedule.createDefault(clock.instant());
            if (scheduleRepo.insertDefaultIfAbsent(candidate)) {
                log.info("Created default schedule {}", candidate.id());
                return Result.success(candidate);
            }
            // Another caller inserted first
            return scheduleRepo.findDefault()
                    .map(Result::success)
                    .orElseGet(() -> Result.failure(ErrorKind.PERSISTENCE_FAILURE,
                            "Default schedule neither inserted nor found"));
        });
    }

    public Result<Schedule> setEnabled(String scheduleId, boolean enabled) {
        return modify(scheduleId, s -> s.withEnabled(enabled, clock.instant()));
    }

    public Result<Schedule> updateTime(String scheduleId, int hour, int minute) {
        return modify(scheduleId, s -> s.withTime(hour, minute, clock.instant()));
    }

    public Result<Schedule> updateDeliveryMethod(String scheduleId, DeliveryMethod method) {
        if (method == null) {
            return Result.failure(ErrorKind.INVALID_ARGUMENT, "Delivery method is required");
        }
        return modify(scheduleId, s -> s.withDeliveryMethod(method, clock.instant()));
    }

    /**
     * Enabled schedules that deliver through the notification channel.
     */
    public Result<List<Schedule>> getNotificationSchedules() {
        return enabledMatching(s -> s.deliveryMethod().includesNotification());
    }

    /**
     * Enabled schedules that deliver to the widget.
     */
    public Result<List<Schedule>> getWidgetSchedules() {
        return enabledMatching(s -> s.deliveryMethod().includesWidget());
    }

    public Result<Optional<Instant>> getNextDeliveryTime(String scheduleId) {
        return getSchedule(scheduleId)
                .map(s -> evaluator.nextDeliveryTime(s, clock.instant(), zone));
    }

    public Result<Integer> getScheduleCount() {
        return guard("count schedules", () -> Result.success(scheduleRepo.countAll()));
    }

    public Result<Integer> getEnabledScheduleCount() {
        return guard("count enabled schedules", () -> Result.success(scheduleRepo.countEnabled()));
    }

    public Result<Optional<Instant>> getMostRecentDeliveryDate() {
        return guard("load most recent delivery date",
                () -> Result.success(scheduleRepo.findMostRecentDeliveryDate()));
    }

    /**
     * Preview the quote the schedule would deliver now. Nothing is recorded.
     */
    public Result<Optional<Quote>> getNextQuoteForSchedule(String scheduleId) {
        return getSchedule(scheduleId).flatMap(s -> selectQuote(s, clock.instant()));
    }

    // ----------------------------------------------------------------------------------------------
    // Delivery
    // ----------------------------------------------------------------------------------------------

    /**
     * Deliver a quote for every schedule that is ready now.
     *
     * Each ready schedule gets exactly one outcome in the report. A failing
     * schedule does not stop the batch.
     */
    public Result<DeliveryReport> deliverDueQuotes() {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        Result<List<Schedule>> enabled = getEnabledSchedules();
        if (enabled.isFailure()) {
            log.error("Delivery batch aborted: {}", enabled.message());
            return Result.failure(enabled.errorKind(), enabled.message(), enabled.cause());
        }

        List<String> ready = evaluator.readySchedules(enabled.value(), startedAt, zone);
        log.info("Delivery batch: {} enabled, {} ready", enabled.value().size(), ready.size());

        List<DeliveryOutcome> outcomes = new ArrayList<>(ready.size());
        for (String scheduleId : ready) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Delivery batch interrupted after {} of {} schedules", outcomes.size(), ready.size());
                break;
            }
            DeliveryOutcome outcome = deliverOne(scheduleId);
            metrics.recordOutcome(outcome.status().name());
            outcomes.add(outcome);
        }

        metrics.recordBatch(ready.size(), Duration.ofNanos(System.nanoTime() - startNanos));
        metrics.updateCacheStats(cache.allStats());

        DeliveryReport report = new DeliveryReport(startedAt, outcomes);
        log.info("Delivery batch done: {} delivered, {} no quote, {} skipped, {} failed",
                report.deliveredCount(),
                report.count(DeliveryOutcome.Status.NO_ELIGIBLE_QUOTE),
                report.count(DeliveryOutcome.Status.SKIPPED),
                report.failedCount());
        return Result.success(report);
    }

    /**
     * Push an eligible quote to the notification channel without recording
     * it or touching the schedule.
     */
    public Result<Quote> sendTestDelivery(String scheduleId) {
        Result<Optional<Quote>> selected = getNextQuoteForSchedule(scheduleId);
        if (selected.isFailure()) {
            return Result.failure(selected.errorKind(), selected.message(), selected.cause());
        }
        if (selected.value().isEmpty()) {
            return Result.notFound("No eligible quote for schedule " + scheduleId);
        }
        Quote quote = selected.value().get();
        try {
            surface.deliver(quote, scheduleId, DeliveryMethod.NOTIFICATION);
        } catch (RuntimeException e) {
            log.error("Test delivery for schedule {} failed: {}", scheduleId, e.getMessage(), e);
            return Result.failure(ErrorKind.DELIVERY_FAILURE, "Test delivery failed: " + e.getMessage(), e);
        }
        log.info("Test delivery of quote {} for schedule {}", quote.id(), scheduleId);
        return Result.success(quote);
    }

    private DeliveryOutcome deliverOne(String scheduleId) {
        ReentrantLock lock = scheduleLocks.computeIfAbsent(scheduleId, id -> new ReentrantLock());
        lock.lock();
        try {
            Instant now = clock.instant();

            Optional<Schedule> fresh = scheduleRepo.findById(scheduleId);
            if (fresh.isEmpty()) {
                return DeliveryOutcome.skipped(scheduleId, "Schedule no longer exists");
            }
            Schedule schedule = fresh.get();
            if (!evaluator.isReady(schedule, now, zone)) {
                return DeliveryOutcome.skipped(scheduleId, "Schedule no longer ready");
            }

            Result<Optional<Quote>> selected = selectQuote(schedule, now);
            if (selected.isFailure()) {
                return DeliveryOutcome.failed(scheduleId, selected.message());
            }
            if (selected.value().isEmpty()) {
                log.info("No eligible quote for schedule {}", scheduleId);
                return DeliveryOutcome.noEligibleQuote(scheduleId);
            }
            Quote quote = selected.value().get();

            Result<Void> recorded = tracker.recordDelivery(scheduleId, quote.id(), now);
            cache.remove(CacheRegion.SCHEDULES, scheduleId);
            if (recorded.isFailure(ErrorKind.ALREADY_DELIVERED)) {
                return DeliveryOutcome.skipped(scheduleId, recorded.message());
            }
            if (recorded.isFailure()) {
                return DeliveryOutcome.failed(scheduleId, recorded.message());
            }

            try {
                surface.deliver(quote, scheduleId, schedule.deliveryMethod());
            } catch (RuntimeException e) {
                log.error("Delivery surface failed for schedule {}: {}", scheduleId, e.getMessage(), e);
            }
            return DeliveryOutcome.delivered(scheduleId, quote.id());

        } catch (RuntimeException e) {
            log.error("Delivery for schedule {} failed: {}", scheduleId, e.getMessage(), e);
            return DeliveryOutcome.failed(scheduleId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private Result<Optional<Quote>> selectQuote(Schedule schedule, Instant now) {
        Result<List<Quote>> candidates = quoteCatalog.candidates(schedule.favoritesOnly());
        if (candidates.isFailure()) {
            return Result.failure(candidates.errorKind(), candidates.message(), candidates.cause());
        }

        List<DeliveryRecord> history = List.of();
        if (schedule.excludeRecentDays() > 0) {
            Result<List<DeliveryRecord>> recent = tracker.recentDeliveries(
                    schedule.id(), QuoteEligibilitySelector.windowStart(schedule, now));
            if (recent.isFailure()) {
                return Result.failure(recent.errorKind(), recent.message(), recent.cause());
            }
            history = recent.value();
        }

        List<Quote> pool = candidates.value();
        return Result.success(selector.selectNext(schedule, pool, history, now)
                .flatMap(id -> pool.stream().filter(q -> q.id().equals(id)).findFirst()));
    }

    private Result<Schedule> modify(String scheduleId, UnaryOperator<Schedule> change) {
        return guard("modify schedule " + scheduleId, () -> {
            Optional<Schedule> existing = scheduleRepo.findById(scheduleId);
            if (existing.isEmpty()) {
                return Result.notFound("Schedule not found: " + scheduleId);
            }
            Schedule changed = change.apply(existing.get());
            Optional<String> invalid = changed.validationError();
            if (invalid.isPresent()) {
                return Result.failure(ErrorKind.INVALID_ARGUMENT, invalid.get());
            }
            boolean updated = scheduleRepo.update(changed);
            cache.remove(CacheRegion.SCHEDULES, scheduleId);
            return updated ? Result.success(changed) : Result.notFound("Schedule not found: " + scheduleId);
        });
    }

    private Result<List<Schedule>> enabledMatching(Predicate<Schedule> filter) {
        return getEnabledSchedules().map(list -> list.stream().filter(filter).toList());
    }

    private <T> Result<T> guard(String action, Supplier<Result<T>> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("Failed to {}: {}", action, e.getMessage());
            return Result.persistenceFailure("Failed to " + action, e);
        }
    }
}
