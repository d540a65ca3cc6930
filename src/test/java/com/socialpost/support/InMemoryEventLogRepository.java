package com.socialpost.support;

import com.socialpost.application.port.out.EventLogRepository;
import com.socialpost.domain.error.ConcurrencyConflictException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Event log held in memory, with the same unique (aggregate, version) rule as the table.
 */
public class InMemoryEventLogRepository implements EventLogRepository {

    private final List<EventRecord> records = new ArrayList<>();

    @Override
    public synchronized void save(EventRecord record) {
        boolean taken = records.stream()
            .anyMatch(r -> r.aggregateId().equals(record.aggregateId()) && r.version() == record.version());
        if (taken) {
            throw ConcurrencyConflictException.versionTaken(record.aggregateId(), record.version());
        }
        records.add(record);
    }

    @Override
    public synchronized List<EventRecord> findByAggregateId(UUID aggregateId) {
        return records.stream()
            .filter(r -> r.aggregateId().equals(aggregateId))
            .sorted(Comparator.comparingInt(EventRecord::version))
            .toList();
    }

    @Override
    public synchronized OptionalInt findLastVersion(UUID aggregateId) {
        return records.stream()
            .filter(r -> r.aggregateId().equals(aggregateId))
            .mapToInt(EventRecord::version)
            .max();
    }

    public synchronized List<EventRecord> all() {
        return List.copyOf(records);
    }
}
