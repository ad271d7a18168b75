package in.heauton.repository;

import in.heauton.application.port.output.ActivityEventRepository;
import in.heauton.domain.common.PersistenceException;
import in.heauton.domain.model.ActivityEvent;
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
import java.util.UUID;

public final class PostgresActivityEventRepository implements ActivityEventRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresActivityEventRepository.class);

    private final DataSource dataSource;

    public PostgresActivityEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(ActivityEvent event) {
        String sql = """
            INSERT INTO user_events (event_id, event_type, related_entity_id, occurred_at)
            VALUES (?, ?, ?, ?)
            """;
        String eventId = event.eventId() != null ? event.eventId() : UUID.randomUUID().toString();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, eventId);
            ps.setString(2, event.eventType());
            ps.setString(3, event.relatedEntityId());
            ps.setTimestamp(4, Timestamp.from(event.occurredAt()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to insert {} event: {}", event.eventType(), e.getMessage());
            throw new PersistenceException("Failed to insert " + event.eventType() + " event", e);
        }
    }

    @Override
    public List<Instant> findTimestamps(String eventType, Instant since) {
        StringBuilder sql = new StringBuilder("SELECT occurred_at FROM user_events WHERE 1 = 1");
        if (eventType != null) {
            sql.append(" AND event_type = ?");
        }
        if (since != null) {
            sql.append(" AND occurred_at >= ?");
        }
        sql.append(" ORDER BY occurred_at");

        List<Instant> timestamps = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int index = 1;
            if (eventType != null) {
                ps.setString(index++, eventType);
            }
            if (since != null) {
                ps.setTimestamp(index, Timestamp.from(since));
            }

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    timestamps.add(rs.getTimestamp("occurred_at").toInstant());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load event timestamps ({}): {}", eventType, e.getMessage());
            throw new PersistenceException("Failed to load event timestamps", e);
        }

        return timestamps;
    }
}
