package in.heauton.repository;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Column encodings shared by the Postgres repositories.
 *
 * String sets are stored as {@code TEXT[]}; active days as comma-separated
 * ISO numbers (1=Monday).
 */
final class SqlCodec {

    private SqlCodec() {
    }

    /**
     * Bind a string set as a {@code TEXT[]} parameter, sorted for stable rows.
     */
    static void setStringArray(PreparedStatement ps, int index, Set<String> values) throws SQLException {
        String[] sorted = values == null ? new String[0] : new TreeSet<>(values).toArray(new String[0]);
        ps.setArray(index, ps.getConnection().createArrayOf("text", sorted));
    }

    static Set<String> getStringSet(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return Set.of();
        }
        try {
            String[] values = (String[]) array.getArray();
            Set<String> result = new LinkedHashSet<>();
            for (String value : values) {
                if (value != null) {
                    result.add(value);
                }
            }
            return Set.copyOf(result);
        } finally {
            array.free();
        }
    }

    static Set<String> splitStrings(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    static String joinDays(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) {
            return "";
        }
        return days.stream()
                .sorted()
                .map(d -> String.valueOf(d.getValue()))
                .collect(Collectors.joining(","));
    }

    /**
     * Unknown day numbers are dropped.
     */
    static Set<DayOfWeek> splitDays(String raw) {
        return splitStrings(raw).stream()
                .map(SqlCodec::parseDay)
                .filter(d -> d != null)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static DayOfWeek parseDay(String value) {
        try {
            int n = Integer.parseInt(value);
            return n >= 1 && n <= 7 ? DayOfWeek.of(n) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static void setTimestampOrNull(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
