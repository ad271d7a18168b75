package in.heauton.testutil;

import in.heauton.application.port.output.ScheduleRepository;
import in.heauton.domain.model.Schedule;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory schedule store with the same conditional-update
 * semantics as the Postgres repository.
 */
public class InMemoryScheduleRepository implements ScheduleRepository {

    private final Map<String, Schedule> rows = new LinkedHashMap<>();
    public final AtomicInteger findByIdCalls = new AtomicInteger();

    private static final Comparator<Schedule> BY_TIME = Comparator
            .comparingInt(Schedule::scheduledHour)
            .thenComparingInt(Schedule::scheduledMinute);

    @Override
    public synchronized List<Schedule> findAll() {
        return rows.values().stream().sorted(BY_TIME).toList();
    }

    @Override
    public synchronized List<Schedule> findEnabled() {
        return rows.values().stream().filter(Schedule::isEnabled).sorted(BY_TIME).toList();
    }

    @Override
    public synchronized Optional<Schedule> findById(String scheduleId) {
        findByIdCalls.incrementAndGet();
        return Optional.ofNullable(rows.get(scheduleId));
    }

    @Override
    public synchronized Optional<Schedule> findDefault() {
        return rows.values().stream().filter(Schedule::isDefault).findFirst();
    }

    @Override
    public synchronized void insert(Schedule schedule) {
        if (rows.containsKey(schedule.id())) {
            throw new IllegalStateException("duplicate key " + schedule.id());
        }
        rows.put(schedule.id(), schedule);
    }

    @Override
    public synchronized boolean insertDefaultIfAbsent(Schedule schedule) {
        if (findDefault().isPresent()) {
            return false;
        }
        rows.put(schedule.id(), schedule);
        return true;
    }

    @Override
    public synchronized boolean update(Schedule schedule) {
        Schedule current = rows.get(schedule.id());
        if (current == null) {
            return false;
        }
        rows.put(schedule.id(), new Schedule(schedule.id(), schedule.isEnabled(), schedule.scheduledHour(),
                schedule.scheduledMinute(), schedule.deliveryMethod(), schedule.favoritesOnly(),
                schedule.categories(), schedule.excludeRecentDays(), schedule.activeDays(),
                current.lastDeliveredQuoteId(), current.lastDeliveryDate(), current.isDefault(),
                current.createdAt(), schedule.updatedAt()));
        return true;
    }

    @Override
    public synchronized boolean updateLastDelivery(String scheduleId, String quoteId, Instant deliveredAt,
                                                   Instant dayStart) {
        Schedule current = rows.get(scheduleId);
        if (current == null) {
            return false;
        }
        if (current.lastDeliveryDate() != null && !current.lastDeliveryDate().isBefore(dayStart)) {
            return false;
        }
        rows.put(scheduleId, current.withLastDelivery(quoteId, deliveredAt));
        return true;
    }

    @Override
    public synchronized boolean delete(String scheduleId) {
        return rows.remove(scheduleId) != null;
    }

    @Override
    public synchronized int deleteAll() {
        int size = rows.size();
        rows.clear();
        return size;
    }

    @Override
    public synchronized int countAll() {
        return rows.size();
    }

    @Override
    public synchronized int countEnabled() {
        return (int) rows.values().stream().filter(Schedule::isEnabled).count();
    }

    @Override
    public synchronized Optional<Instant> findMostRecentDeliveryDate() {
        return rows.values().stream()
                .map(Schedule::lastDeliveryDate)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    /** Store a row as-is, delivery pointers included. */
    public synchronized void put(Schedule schedule) {
        rows.put(schedule.id(), schedule);
    }
}
