package com.socialpost.application.port.out;

import com.socialpost.domain.event.PostEvent;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Append-only storage of persisted events.
 */
public interface EventLogRepository {

    /**
     * Stores one record. Implementations reject a second record with the same
     * aggregate id and version by throwing a concurrency conflict.
     */
    void save(EventRecord record);

    /**
     * Returns every record for the aggregate in ascending version order.
     */
    List<EventRecord> findByAggregateId(UUID aggregateId);

    OptionalInt findLastVersion(UUID aggregateId);

    record EventRecord(
        UUID id,
        Instant timestamp,
        UUID aggregateId,
        String aggregateType,
        int version,
        String eventType,
        PostEvent event
    ) {
        public static EventRecord of(UUID id, String aggregateType, PostEvent event) {
            return new EventRecord(
                id,
                Instant.now(),
                event.aggregateId(),
                aggregateType,
                event.version(),
                event.eventType().discriminator(),
                event
            );
        }
    }
}
