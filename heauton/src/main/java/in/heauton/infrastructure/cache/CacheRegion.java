package in.heauton.infrastructure.cache;

import in.heauton.domain.model.Quote;
import in.heauton.domain.model.Schedule;

import java.util.Objects;

/**
 * Typed cache partition key.
 *
 * The value class travels with the region so reads are checked casts
 * rather than unchecked ones.
 */
public final class CacheRegion<V> {

    public static final CacheRegion<Quote> QUOTES = new CacheRegion<>("quote", Quote.class);
    public static final CacheRegion<Schedule> SCHEDULES = new CacheRegion<>("schedule", Schedule.class);

    private final String name;
    private final Class<V> valueType;

    public CacheRegion(String name, Class<V> valueType) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public String name() {
        return name;
    }

    public Class<V> valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheRegion<?> other = (CacheRegion<?>) o;
        return name.equals(other.name) && valueType.equals(other.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, valueType);
    }

    @Override
    public String toString() {
        return name;
    }
}
