package in.heauton.service.delivery;

import in.heauton.domain.common.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link ScheduleStore#deliverDueQuotes()} periodically.
 *
 * A run that fails is logged and the next run goes ahead on schedule;
 * there is no retry in between.
 */
public final class DeliveryTrigger {
    private static final Logger log = LoggerFactory.getLogger(DeliveryTrigger.class);

    private final ScheduleStore scheduleStore;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public DeliveryTrigger(ScheduleStore scheduleStore, Duration interval) {
        this.scheduleStore = scheduleStore;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "delivery-trigger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Delivery trigger already started");
            return;
        }
        scheduler.scheduleAtFixedRate(this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Delivery trigger started (every {} min)", interval.toMinutes());
    }

    /**
     * Stop the trigger. A batch in progress is interrupted between schedules;
     * deliveries already recorded stay recorded.
     */
    public void stop() {
        log.info("Stopping delivery trigger...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            log.info("Delivery trigger stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void runOnce() {
        try {
            Result<DeliveryReport> result = scheduleStore.deliverDueQuotes();
            if (result.isFailure()) {
                log.warn("Delivery run failed, retrying next cycle: {}", result.message());
            }
        } catch (RuntimeException e) {
            // Escaping exceptions would cancel the periodic task
            log.error("Delivery run crashed: {}", e.getMessage(), e);
        }
    }
}
