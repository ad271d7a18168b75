package in.heauton.testutil;

import in.heauton.application.port.output.DeliveryRecordRepository;
import in.heauton.domain.model.DeliveryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class InMemoryDeliveryRecordRepository implements DeliveryRecordRepository {

    private final List<DeliveryRecord> rows = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized DeliveryRecord insert(String scheduleId, String quoteId, Instant deliveredAt) {
        DeliveryRecord record = new DeliveryRecord(nextId++, quoteId, scheduleId, deliveredAt);
        rows.add(record);
        return record;
    }

    @Override
    public synchronized List<DeliveryRecord> findByScheduleSince(String scheduleId, Instant since) {
        return rows.stream()
                .filter(r -> r.scheduleId().equals(scheduleId) && !r.deliveredAt().isBefore(since))
                .sorted(Comparator.comparing(DeliveryRecord::deliveredAt).reversed())
                .toList();
    }

    @Override
    public synchronized int deleteOlderThan(Instant cutoff) {
        int before = rows.size();
        rows.removeIf(r -> r.deliveredAt().isBefore(cutoff));
        return before - rows.size();
    }

    @Override
    public synchronized boolean deleteById(long recordId) {
        return rows.removeIf(r -> r.recordId() == recordId);
    }

    public synchronized List<DeliveryRecord> all() {
        return List.copyOf(rows);
    }

    public synchronized void add(String scheduleId, String quoteId, Instant deliveredAt) {
        insert(scheduleId, quoteId, deliveredAt);
    }
}
