package in.heauton.repository;

import in.heauton.application.port.output.QuoteRepository;
import in.heauton.domain.common.PersistenceException;
import in.heauton.domain.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.heauton.repository.SqlCodec.getStringSet;

public final class PostgresQuoteRepository implements QuoteRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresQuoteRepository.class);

    private static final String COLUMNS = "id, text, author, categories, is_favorite";

    private final DataSource dataSource;

    public PostgresQuoteRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Quote> findAll() {
        return query("SELECT " + COLUMNS + " FROM quotes ORDER BY id", "load quotes");
    }

    @Override
    public List<Quote> findFavorites() {
        return query("SELECT " + COLUMNS + " FROM quotes WHERE is_favorite = TRUE ORDER BY id",
                "load favorite quotes");
    }

    @Override
    public Optional<Quote> findById(String quoteId) {
        String sql = "SELECT " + COLUMNS + " FROM quotes WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, quoteId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find quote {}: {}", quoteId, e.getMessage());
            throw new PersistenceException("Failed to find quote " + quoteId, e);
        }

        return Optional.empty();
    }

    @Override
    public int count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM quotes");
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;

        } catch (SQLException e) {
            log.error("Failed to count quotes: {}", e.getMessage());
            throw new PersistenceException("Failed to count quotes", e);
        }
    }

    private List<Quote> query(String sql, String what) {
        List<Quote> quotes = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                quotes.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw new PersistenceException("Failed to " + what, e);
        }

        return quotes;
    }

    private Quote mapRow(ResultSet rs) throws SQLException {
        return new Quote(
                rs.getString("id"),
                rs.getString("text"),
                rs.getString("author"),
                getStringSet(rs, "categories"),
                rs.getBoolean("is_favorite"));
    }
}
