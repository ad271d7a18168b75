package in.heauton.infrastructure.metrics;

import in.heauton.infrastructure.cache.CacheStats;

import java.time.Duration;
import java.util.List;

/**
 * Delivery engine metrics.
 *
 * Key metrics:
 * - per-schedule delivery outcomes of each batch
 * - batch duration
 * - delivery surface failures
 * - pruned history records
 * - cache region occupancy and hit counts
 */
public interface DeliveryMetrics {

    /**
     * @param outcome outcome name (DELIVERED, NO_ELIGIBLE_QUOTE, SKIPPED, FAILED)
     */
    void recordOutcome(String outcome);

    void recordBatch(int readyCount, Duration duration);

    /**
     * @param channel channel that failed (notification, widget)
     */
    void recordSurfaceFailure(String channel);

    void recordPruned(int records);

    void updateCacheStats(List<CacheStats> stats);

    /**
     * Metrics sink that discards everything.
     */
    DeliveryMetrics NOOP = new DeliveryMetrics() {
        @Override
        public void recordOutcome(String outcome) {
        }

        @Override
        public void recordBatch(int readyCount, Duration duration) {
        }

        @Override
        public void recordSurfaceFailure(String channel) {
        }

        @Override
        public void recordPruned(int records) {
        }

        @Override
        public void updateCacheStats(List<CacheStats> stats) {
        }
    };
}
