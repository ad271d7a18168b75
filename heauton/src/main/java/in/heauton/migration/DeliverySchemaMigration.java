package in.heauton.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Creates the delivery engine tables on startup.
 *
 * Tables:
 * - quotes: read-only quote catalog (normally populated by the content import)
 * - quote_schedules: delivery schedules, at most one flagged as default
 * - delivered_quotes: append-only delivery history
 * - user_events: activity events feeding engagement streaks
 */
public final class DeliverySchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(DeliverySchemaMigration.class);

    private final DataSource dataSource;

    public DeliverySchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[SCHEMA] Starting delivery schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "quotes", """
                CREATE TABLE quotes (
                    id VARCHAR(64) PRIMARY KEY,
                    text TEXT NOT NULL,
                    author VARCHAR(255),
                    categories TEXT[] NOT NULL DEFAULT '{}',
                    is_favorite BOOLEAN NOT NULL DEFAULT FALSE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            createIfMissing(conn, "quote_schedules", """
                CREATE TABLE quote_schedules (
                    id VARCHAR(64) PRIMARY KEY,
                    is_enabled BOOLEAN NOT NULL DEFAULT TRUE,
                    scheduled_hour INT NOT NULL CHECK (scheduled_hour BETWEEN 0 AND 23),
                    scheduled_minute INT NOT NULL CHECK (scheduled_minute BETWEEN 0 AND 59),
                    delivery_method VARCHAR(20) NOT NULL DEFAULT 'BOTH',
                    favorites_only BOOLEAN NOT NULL DEFAULT FALSE,
                    categories TEXT[] NOT NULL DEFAULT '{}',
                    exclude_recent_days INT NOT NULL DEFAULT 7 CHECK (exclude_recent_days >= 0),
                    active_days VARCHAR(20) NOT NULL DEFAULT '',
                    last_delivered_quote_id VARCHAR(64),
                    last_delivery_date TIMESTAMPTZ,
                    is_default BOOLEAN NOT NULL DEFAULT FALSE,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);
            execute(conn, """
                CREATE UNIQUE INDEX IF NOT EXISTS uq_quote_schedules_default
                    ON quote_schedules (is_default) WHERE is_default
                """);

            createIfMissing(conn, "delivered_quotes", """
                CREATE TABLE delivered_quotes (
                    record_id BIGSERIAL PRIMARY KEY,
                    quote_id VARCHAR(64) NOT NULL,
                    schedule_id VARCHAR(64) NOT NULL,
                    delivered_at TIMESTAMPTZ NOT NULL
                )
                """);
            execute(conn, """
                CREATE INDEX IF NOT EXISTS idx_delivered_quotes_schedule
                    ON delivered_quotes (schedule_id, delivered_at DESC)
                """);

            createIfMissing(conn, "user_events", """
                CREATE TABLE user_events (
                    event_id VARCHAR(64) PRIMARY KEY,
                    event_type VARCHAR(50) NOT NULL,
                    related_entity_id VARCHAR(64),
                    occurred_at TIMESTAMPTZ NOT NULL
                )
                """);
            execute(conn, """
                CREATE INDEX IF NOT EXISTS idx_user_events_type_time
                    ON user_events (event_type, occurred_at)
                """);

            log.info("[SCHEMA] Migration completed successfully");

        } catch (Exception e) {
            log.error("[SCHEMA] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Delivery schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws Exception {
        if (tableExists(conn, table)) {
            log.info("[SCHEMA] {} table already exists", table);
            return;
        }
        log.info("[SCHEMA] Creating {} table...", table);
        execute(conn, ddl);
        log.info("[SCHEMA] {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        }
    }
}
