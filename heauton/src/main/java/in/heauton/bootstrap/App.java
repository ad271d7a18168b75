package in.heauton.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.heauton.config.DeliveryConfig;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.Schedule;
import in.heauton.infrastructure.cache.BoundedCache;
import in.heauton.infrastructure.metrics.PrometheusDeliveryMetrics;
import in.heauton.infrastructure.metrics.PrometheusMetricsHandler;
import in.heauton.infrastructure.surface.ChannelDeliverySurface;
import in.heauton.infrastructure.surface.LoggingDeliveryChannel;
import in.heauton.migration.DeliverySchemaMigration;
import in.heauton.repository.PostgresActivityEventRepository;
import in.heauton.repository.PostgresDeliveryRecordRepository;
import in.heauton.repository.PostgresQuoteRepository;
import in.heauton.repository.PostgresScheduleRepository;
import in.heauton.service.QuoteCatalog;
import in.heauton.service.delivery.DeliveryHistoryTracker;
import in.heauton.service.delivery.DeliveryReadinessEvaluator;
import in.heauton.service.delivery.DeliveryTrigger;
import in.heauton.service.delivery.QuoteEligibilitySelector;
import in.heauton.service.delivery.ScheduleStore;
import in.heauton.service.streak.EngagementStatsService;
import in.heauton.transport.http.EngagementApiHandler;
import in.heauton.transport.http.ScheduleApiHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Heauton quote delivery engine.
 *
 * Startup order: database pool, schema migration, repositories, services,
 * default schedule, HTTP API, delivery trigger.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== Heauton delivery engine starting ===");

        DeliveryConfig config = DeliveryConfig.fromEnv();
        log.info("Config: {}", config);

        // Database
        HikariDataSource dataSource = createDataSource(config);
        new DeliverySchemaMigration(dataSource).migrate();

        PostgresScheduleRepository scheduleRepo = new PostgresScheduleRepository(dataSource);
        PostgresDeliveryRecordRepository recordRepo = new PostgresDeliveryRecordRepository(dataSource);
        PostgresQuoteRepository quoteRepo = new PostgresQuoteRepository(dataSource);
        PostgresActivityEventRepository eventRepo = new PostgresActivityEventRepository(dataSource);

        // Metrics
        PrometheusDeliveryMetrics metrics = new PrometheusDeliveryMetrics();

        // Services
        Clock clock = Clock.system(config.zone());
        BoundedCache cache = new BoundedCache(config.cacheCapacity());
        QuoteCatalog quoteCatalog = new QuoteCatalog(quoteRepo, cache);
        DeliveryHistoryTracker tracker = new DeliveryHistoryTracker(
                recordRepo, scheduleRepo, config.zone(), config.historyRetentionDays(), metrics);
        ChannelDeliverySurface surface = new ChannelDeliverySurface(
                new LoggingDeliveryChannel("notification"), new LoggingDeliveryChannel("widget"), metrics);

        ScheduleStore scheduleStore = new ScheduleStore(
                scheduleRepo,
                quoteCatalog,
                new QuoteEligibilitySelector(),
                new DeliveryReadinessEvaluator(),
                tracker,
                surface,
                cache,
                metrics,
                clock);
        EngagementStatsService statsService = new EngagementStatsService(eventRepo, clock);

        Result<Schedule> defaultSchedule = scheduleStore.ensureDefaultSchedule();
        if (defaultSchedule.isFailure()) {
            log.error("Could not ensure default schedule: {}", defaultSchedule.message());
        } else {
            log.info("Default schedule: {}", defaultSchedule.value().id());
        }

        // HTTP API
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        ScheduleApiHandler api = new ScheduleApiHandler(scheduleStore, cache, objectMapper);
        EngagementApiHandler engagement = new EngagementApiHandler(statsService, objectMapper);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(
                metrics.getRegistry(), () -> metrics.updateCacheStats(cache.allStats()));

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/schedules", api::listSchedules)
            .post("/api/schedules", api::createSchedule)
            .get("/api/schedules/{id}", api::getSchedule)
            .put("/api/schedules/{id}", api::updateSchedule)
            .delete("/api/schedules/{id}", api::deleteSchedule)
            .post("/api/schedules/{id}/test", api::sendTestDelivery)
            .post("/api/deliveries/run", api::runDeliveries)
            .get("/api/cache/stats", api::cacheStats)
            .get("/api/engagement/streaks", engagement::streaks)
            .post("/api/engagement/events", engagement::recordEvent)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Heauton delivery engine\n\n" +
                    "API: GET /api/health, /api/schedules, /api/cache/stats, /api/engagement/streaks\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        // Handlers call JDBC, keep them off the IO threads
        Undertow server = Undertow.builder()
            .addHttpListener(config.httpPort(), "0.0.0.0")
            .setHandler(new BlockingHandler(routes))
            .build();
        server.start();
        log.info("HTTP API started on http://localhost:{}/", config.httpPort());

        // Delivery trigger
        DeliveryTrigger trigger = new DeliveryTrigger(scheduleStore, config.deliveryInterval());
        trigger.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            trigger.stop();
            server.stop();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource(DeliveryConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("heauton-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
