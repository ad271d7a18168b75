package in.heauton.repository;

import in.heauton.application.port.output.DeliveryRecordRepository;
import in.heauton.domain.common.PersistenceException;
import in.heauton.domain.model.DeliveryRecord;
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

public final class PostgresDeliveryRecordRepository implements DeliveryRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDeliveryRecordRepository.class);

    private final DataSource dataSource;

    public PostgresDeliveryRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DeliveryRecord insert(String scheduleId, String quoteId, Instant deliveredAt) {
        String sql = """
            INSERT INTO delivered_quotes (quote_id, schedule_id, delivered_at)
            VALUES (?, ?, ?)
            RETURNING record_id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, quoteId);
            ps.setString(2, scheduleId);
            ps.setTimestamp(3, Timestamp.from(deliveredAt));

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PersistenceException("No record id returned for delivery of " + quoteId);
                }
                long recordId = rs.getLong(1);
                log.debug("Delivery recorded: #{} quote {} for schedule {}", recordId, quoteId, scheduleId);
                return new DeliveryRecord(recordId, quoteId, scheduleId, deliveredAt);
            }

        } catch (SQLException e) {
            log.error("Failed to record delivery of {} for schedule {}: {}", quoteId, scheduleId, e.getMessage());
            throw new PersistenceException("Failed to record delivery of " + quoteId, e);
        }
    }

    @Override
    public List<DeliveryRecord> findByScheduleSince(String scheduleId, Instant since) {
        String sql = """
            SELECT record_id, quote_id, schedule_id, delivered_at
            FROM delivered_quotes
            WHERE schedule_id = ? AND delivered_at >= ?
            ORDER BY delivered_at DESC
            """;
        List<DeliveryRecord> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            ps.setTimestamp(2, Timestamp.from(since));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load delivery history of schedule {}: {}", scheduleId, e.getMessage());
            throw new PersistenceException("Failed to load delivery history of schedule " + scheduleId, e);
        }

        return records;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM delivered_quotes WHERE delivered_at < ?")) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to prune delivery history before {}: {}", cutoff, e.getMessage());
            throw new PersistenceException("Failed to prune delivery history", e);
        }
    }

    @Override
    public boolean deleteById(long recordId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM delivered_quotes WHERE record_id = ?")) {

            ps.setLong(1, recordId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to delete delivery record #{}: {}", recordId, e.getMessage());
            throw new PersistenceException("Failed to delete delivery record " + recordId, e);
        }
    }

    private DeliveryRecord mapRow(ResultSet rs) throws SQLException {
        return new DeliveryRecord(
                rs.getLong("record_id"),
                rs.getString("quote_id"),
                rs.getString("schedule_id"),
                rs.getTimestamp("delivered_at").toInstant());
    }
}
