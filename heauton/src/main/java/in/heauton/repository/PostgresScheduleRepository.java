package in.heauton.repository;

import in.heauton.application.port.output.ScheduleRepository;
import in.heauton.domain.common.PersistenceException;
import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.heauton.repository.SqlCodec.getInstant;
import static in.heauton.repository.SqlCodec.getStringSet;
import static in.heauton.repository.SqlCodec.joinDays;
import static in.heauton.repository.SqlCodec.setStringArray;
import static in.heauton.repository.SqlCodec.setTimestampOrNull;
import static in.heauton.repository.SqlCodec.splitDays;

public final class PostgresScheduleRepository implements ScheduleRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresScheduleRepository.class);

    private static final String ORDER_BY_TIME = " ORDER BY scheduled_hour, scheduled_minute, created_at";

    private final DataSource dataSource;

    public PostgresScheduleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Schedule> findAll() {
        return query("SELECT * FROM quote_schedules" + ORDER_BY_TIME, "find all schedules");
    }

    @Override
    public List<Schedule> findEnabled() {
        return query("SELECT * FROM quote_schedules WHERE is_enabled = TRUE" + ORDER_BY_TIME,
                "find enabled schedules");
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        String sql = "SELECT * FROM quote_schedules WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find schedule {}: {}", scheduleId, e.getMessage());
            throw new PersistenceException("Failed to find schedule " + scheduleId, e);
        }

        return Optional.empty();
    }

    @Override
    public Optional<Schedule> findDefault() {
        List<Schedule> defaults = query("SELECT * FROM quote_schedules WHERE is_default = TRUE LIMIT 1",
                "find default schedule");
        return defaults.stream().findFirst();
    }

    @Override
    public void insert(Schedule schedule) {
        String sql = insertSql("");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            bindInsert(ps, schedule);
            ps.executeUpdate();
            log.info("Schedule inserted: {} at {}:{} ({})", schedule.id(),
                    schedule.scheduledHour(), schedule.scheduledMinute(), schedule.deliveryMethod());

        } catch (SQLException e) {
            log.error("Failed to insert schedule {}: {}", schedule.id(), e.getMessage());
            throw new PersistenceException("Failed to insert schedule " + schedule.id(), e);
        }
    }

    @Override
    public boolean insertDefaultIfAbsent(Schedule schedule) {
        // Conflicts on the partial unique index over is_default
        String sql = insertSql(" ON CONFLICT DO NOTHING");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            bindInsert(ps, schedule);
            boolean inserted = ps.executeUpdate() > 0;
            if (inserted) {
                log.info("Default schedule created: {}", schedule.id());
            }
            return inserted;

        } catch (SQLException e) {
            log.error("Failed to insert default schedule: {}", e.getMessage());
            throw new PersistenceException("Failed to insert default schedule", e);
        }
    }

    @Override
    public boolean update(Schedule schedule) {
        String sql = """
            UPDATE quote_schedules SET
                is_enabled = ?,
                scheduled_hour = ?,
                scheduled_minute = ?,
                delivery_method = ?,
                favorites_only = ?,
                categories = ?,
                exclude_recent_days = ?,
                active_days = ?,
                updated_at = ?
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, schedule.isEnabled());
            ps.setInt(2, schedule.scheduledHour());
            ps.setInt(3, schedule.scheduledMinute());
            ps.setString(4, schedule.deliveryMethod().name());
            ps.setBoolean(5, schedule.favoritesOnly());
            setStringArray(ps, 6, schedule.categories());
            ps.setInt(7, schedule.excludeRecentDays());
            ps.setString(8, joinDays(schedule.activeDays()));
            ps.setTimestamp(9, Timestamp.from(schedule.updatedAt() != null ? schedule.updatedAt() : Instant.now()));
            ps.setString(10, schedule.id());

            int rows = ps.executeUpdate();
            log.debug("Schedule {} updated: {} row(s)", schedule.id(), rows);
            return rows > 0;

        } catch (SQLException e) {
            log.error("Failed to update schedule {}: {}", schedule.id(), e.getMessage());
            throw new PersistenceException("Failed to update schedule " + schedule.id(), e);
        }
    }

    @Override
    public boolean updateLastDelivery(String scheduleId, String quoteId, Instant deliveredAt, Instant dayStart) {
        String sql = """
            UPDATE quote_schedules SET
                last_delivered_quote_id = ?,
                last_delivery_date = ?,
                updated_at = ?
            WHERE id = ?
              AND (last_delivery_date IS NULL OR last_delivery_date < ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, quoteId);
            ps.setTimestamp(2, Timestamp.from(deliveredAt));
            ps.setTimestamp(3, Timestamp.from(deliveredAt));
            ps.setString(4, scheduleId);
            ps.setTimestamp(5, Timestamp.from(dayStart));

            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to update last delivery of schedule {}: {}", scheduleId, e.getMessage());
            throw new PersistenceException("Failed to update last delivery of schedule " + scheduleId, e);
        }
    }

    @Override
    public boolean delete(String scheduleId) {
        String sql = "DELETE FROM quote_schedules WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            boolean deleted = ps.executeUpdate() > 0;
            if (deleted) {
                log.info("Schedule deleted: {}", scheduleId);
            }
            return deleted;

        } catch (SQLException e) {
            log.error("Failed to delete schedule {}: {}", scheduleId, e.getMessage());
            throw new PersistenceException("Failed to delete schedule " + scheduleId, e);
        }
    }

    @Override
    public int deleteAll() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM quote_schedules")) {

            int rows = ps.executeUpdate();
            log.info("Deleted {} schedule(s)", rows);
            return rows;

        } catch (SQLException e) {
            log.error("Failed to delete schedules: {}", e.getMessage());
            throw new PersistenceException("Failed to delete schedules", e);
        }
    }

    @Override
    public int countAll() {
        return count("SELECT COUNT(*) FROM quote_schedules");
    }

    @Override
    public int countEnabled() {
        return count("SELECT COUNT(*) FROM quote_schedules WHERE is_enabled = TRUE");
    }

    @Override
    public Optional<Instant> findMostRecentDeliveryDate() {
        String sql = "SELECT MAX(last_delivery_date) AS most_recent FROM quote_schedules";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                return Optional.ofNullable(getInstant(rs, "most_recent"));
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("Failed to find most recent delivery date: {}", e.getMessage());
            throw new PersistenceException("Failed to find most recent delivery date", e);
        }
    }

    private List<Schedule> query(String sql, String what) {
        List<Schedule> schedules = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw new PersistenceException("Failed to " + what, e);
        }

        return schedules;
    }

    private int count(String sql) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;

        } catch (SQLException e) {
            log.error("Failed to count schedules: {}", e.getMessage());
            throw new PersistenceException("Failed to count schedules", e);
        }
    }

    private static String insertSql(String suffix) {
        return """
            INSERT INTO quote_schedules (
                id, is_enabled, scheduled_hour, scheduled_minute, delivery_method,
                favorites_only, categories, exclude_recent_days, active_days,
                last_delivered_quote_id, last_delivery_date, is_default, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """ + suffix;
    }

    private static void bindInsert(PreparedStatement ps, Schedule s) throws SQLException {
        Instant now = Instant.now();
        ps.setString(1, s.id());
        ps.setBoolean(2, s.isEnabled());
        ps.setInt(3, s.scheduledHour());
        ps.setInt(4, s.scheduledMinute());
        ps.setString(5, s.deliveryMethod().name());
        ps.setBoolean(6, s.favoritesOnly());
        setStringArray(ps, 7, s.categories());
        ps.setInt(8, s.excludeRecentDays());
        ps.setString(9, joinDays(s.activeDays()));
        ps.setString(10, s.lastDeliveredQuoteId());
        setTimestampOrNull(ps, 11, s.lastDeliveryDate());
        ps.setBoolean(12, s.isDefault());
        ps.setTimestamp(13, Timestamp.from(s.createdAt() != null ? s.createdAt() : now));
        ps.setTimestamp(14, Timestamp.from(s.updatedAt() != null ? s.updatedAt() : now));
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return new Schedule(
                rs.getString("id"),
                rs.getBoolean("is_enabled"),
                rs.getInt("scheduled_hour"),
                rs.getInt("scheduled_minute"),
                DeliveryMethod.fromName(rs.getString("delivery_method")),
                rs.getBoolean("favorites_only"),
                getStringSet(rs, "categories"),
                rs.getInt("exclude_recent_days"),
                splitDays(rs.getString("active_days")),
                rs.getString("last_delivered_quote_id"),
                getInstant(rs, "last_delivery_date"),
                rs.getBoolean("is_default"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"));
    }
}
