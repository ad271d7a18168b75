package in.heauton.infrastructure.metrics;

import in.heauton.infrastructure.cache.CacheStats;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Prometheus implementation of DeliveryMetrics.
 *
 * Metrics:
 * - heauton_deliveries_total{outcome}
 * - heauton_delivery_batch_seconds
 * - heauton_delivery_batch_ready_schedules
 * - heauton_surface_failures_total{channel}
 * - heauton_history_pruned_total
 * - heauton_cache_entries{region}, heauton_cache_hits{region}, heauton_cache_misses{region},
 *   heauton_cache_evictions{region}
 */
public class PrometheusDeliveryMetrics implements DeliveryMetrics {

    private final CollectorRegistry registry;

    private final Counter deliveries;
    private final Histogram batchDuration;
    private final Gauge batchReady;
    private final Counter surfaceFailures;
    private final Counter pruned;
    private final Gauge cacheEntries;
    private final Gauge cacheHits;
    private final Gauge cacheMisses;
    private final Gauge cacheEvictions;

    public PrometheusDeliveryMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusDeliveryMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.deliveries = Counter.build()
            .name("heauton_deliveries_total")
            .help("Per-schedule delivery outcomes")
            .labelNames("outcome")
            .register(registry);

        this.batchDuration = Histogram.build()
            .name("heauton_delivery_batch_seconds")
            .help("Duration of a delivery batch in seconds")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 30.0)
            .register(registry);

        this.batchReady = Gauge.build()
            .name("heauton_delivery_batch_ready_schedules")
            .help("Number of ready schedules in the last batch")
            .register(registry);

        this.surfaceFailures = Counter.build()
            .name("heauton_surface_failures_total")
            .help("Delivery surface failures")
            .labelNames("channel")
            .register(registry);

        this.pruned = Counter.build()
            .name("heauton_history_pruned_total")
            .help("Delivery records removed by retention pruning")
            .register(registry);

        this.cacheEntries = regionGauge("heauton_cache_entries", "Entries held per cache region");
        this.cacheHits = regionGauge("heauton_cache_hits", "Cache hits per region");
        this.cacheMisses = regionGauge("heauton_cache_misses", "Cache misses per region");
        this.cacheEvictions = regionGauge("heauton_cache_evictions", "Cache evictions per region");
    }

    private Gauge regionGauge(String name, String help) {
        return Gauge.build()
            .name(name)
            .help(help)
            .labelNames("region")
            .register(registry);
    }

    @Override
    public void recordOutcome(String outcome) {
        deliveries.labels(outcome.toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordBatch(int readyCount, Duration duration) {
        batchReady.set(readyCount);
        batchDuration.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordSurfaceFailure(String channel) {
        surfaceFailures.labels(channel).inc();
    }

    @Override
    public void recordPruned(int records) {
        if (records > 0) {
            pruned.inc(records);
        }
    }

    @Override
    public void updateCacheStats(List<CacheStats> stats) {
        for (CacheStats s : stats) {
            cacheEntries.labels(s.region()).set(s.size());
            cacheHits.labels(s.region()).set(s.hits());
            cacheMisses.labels(s.region()).set(s.misses());
            cacheEvictions.labels(s.region()).set(s.evictions());
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
