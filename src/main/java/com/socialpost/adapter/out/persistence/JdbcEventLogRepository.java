package com.socialpost.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialpost.application.port.out.EventLogRepository;
import com.socialpost.domain.error.ConcurrencyConflictException;
import com.socialpost.domain.event.PostEvent;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;

@Repository
public class JdbcEventLogRepository implements EventLogRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<EventRecord> rowMapper;

    public JdbcEventLogRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new EventRecord(
            rs.getObject("id", UUID.class),
            rs.getTimestamp("time_stamp").toInstant(),
            rs.getObject("aggregate_id", UUID.class),
            rs.getString("aggregate_type"),
            rs.getInt("version"),
            rs.getString("event_type"),
            readEvent(rs.getString("payload"))
        );
    }

    @Override
    public void save(EventRecord record) {
        String payload;
        try {
            payload = objectMapper.writerFor(PostEvent.class).writeValueAsString(record.event());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + record.eventType(), e);
        }
        try {
            jdbc.update("""
                INSERT INTO event_store (id, time_stamp, aggregate_id, aggregate_type, version, event_type, payload)
                VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
                """,
                record.id(),
                Timestamp.from(record.timestamp()),
                record.aggregateId(),
                record.aggregateType(),
                record.version(),
                record.eventType(),
                payload
            );
        } catch (DuplicateKeyException e) {
            // (aggregate_id, version) already taken by a concurrent writer
            throw ConcurrencyConflictException.versionTaken(record.aggregateId(), record.version());
        }
    }

    @Override
    public List<EventRecord> findByAggregateId(UUID aggregateId) {
        return jdbc.query("""
            SELECT id, time_stamp, aggregate_id, aggregate_type, version, event_type, payload
            FROM event_store
            WHERE aggregate_id = ?
            ORDER BY version
            """,
            rowMapper,
            aggregateId
        );
    }

    @Override
    public OptionalInt findLastVersion(UUID aggregateId) {
        Integer version = jdbc.queryForObject(
            "SELECT MAX(version) FROM event_store WHERE aggregate_id = ?",
            Integer.class,
            aggregateId
        );
        return version != null ? OptionalInt.of(version) : OptionalInt.empty();
    }

    private PostEvent readEvent(String payload) {
        try {
            return objectMapper.readValue(payload, PostEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored event payload cannot be read", e);
        }
    }
}
