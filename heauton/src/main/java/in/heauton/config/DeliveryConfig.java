package in.heauton.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime settings of the delivery engine.
 *
 * @param zone                 zone that defines "today" for readiness and streaks
 * @param cacheCapacity        entries per cache region
 * @param historyRetentionDays delivery records older than this are pruned
 * @param deliveryInterval     period of the delivery trigger
 * @param httpPort             port of the HTTP API
 */
public record DeliveryConfig(
        ZoneId zone,
        int cacheCapacity,
        int historyRetentionDays,
        Duration deliveryInterval,
        int httpPort,
        String dbUrl,
        String dbUser,
        String dbPass,
        int dbPoolSize) {

    private static final Logger log = LoggerFactory.getLogger(DeliveryConfig.class);

    public static final int DEFAULT_CACHE_CAPACITY = 50;
    public static final int DEFAULT_HISTORY_RETENTION_DAYS = 30;
    public static final int DEFAULT_DELIVERY_INTERVAL_MINUTES = 60;
    public static final int DEFAULT_PORT = 9090;

    public DeliveryConfig {
        if (zone == null) {
            throw new IllegalArgumentException("zone must not be null");
        }
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("cacheCapacity must be >= 1, was " + cacheCapacity);
        }
        if (historyRetentionDays < 1) {
            throw new IllegalArgumentException("historyRetentionDays must be >= 1, was " + historyRetentionDays);
        }
        if (deliveryInterval == null || deliveryInterval.isZero() || deliveryInterval.isNegative()) {
            throw new IllegalArgumentException("deliveryInterval must be positive");
        }
    }

    public static DeliveryConfig fromEnv() {
        return new DeliveryConfig(
                parseZone(setting("HEAUTON_ZONE", null)),
                intSetting("CACHE_CAPACITY", DEFAULT_CACHE_CAPACITY),
                intSetting("HISTORY_RETENTION_DAYS", DEFAULT_HISTORY_RETENTION_DAYS),
                Duration.ofMinutes(intSetting("DELIVERY_INTERVAL_MINUTES", DEFAULT_DELIVERY_INTERVAL_MINUTES)),
                intSetting("PORT", DEFAULT_PORT),
                setting("DB_URL", "jdbc:postgresql://localhost:5432/heauton"),
                setting("DB_USER", "postgres"),
                setting("DB_PASS", "postgres"),
                intSetting("DB_POOL_SIZE", 5));
    }

    /**
     * Environment variable, then system property, then {@code defaultValue}.
     */
    static String setting(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    static int intSetting(String key, int defaultValue) {
        String value = setting(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown zone '{}', using system default {}", value, ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    @Override
    public String toString() {
        // dbPass left out
        return "DeliveryConfig[zone=" + zone + ", cacheCapacity=" + cacheCapacity
                + ", historyRetentionDays=" + historyRetentionDays + ", deliveryInterval=" + deliveryInterval
                + ", httpPort=" + httpPort + ", dbUrl=" + dbUrl + ", dbUser=" + dbUser
                + ", dbPoolSize=" + dbPoolSize + "]";
    }
}
