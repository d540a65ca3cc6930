package com.socialpost.application.service;

import com.socialpost.application.port.out.EventLogRepository;
import com.socialpost.application.port.out.EventLogRepository.EventRecord;
import com.socialpost.application.port.out.EventPublisher;
import com.socialpost.application.port.out.IdGenerator;
import com.socialpost.application.port.out.MetricsPort;
import com.socialpost.domain.error.AggregateNotFoundException;
import com.socialpost.domain.error.ConcurrencyConflictException;
import com.socialpost.domain.event.PostEvent;
import com.socialpost.domain.model.PostAggregate;
import com.socialpost.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class PostEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(PostEventStore.class);

    private final EventLogRepository eventLogRepository;
    private final EventPublisher eventPublisher;
    private final TransactionOperations transactionOperations;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final AppProperties appProperties;

    public PostEventStore(
            EventLogRepository eventLogRepository,
            EventPublisher eventPublisher,
            TransactionOperations transactionOperations,
            IdGenerator idGenerator,
            MetricsPort metrics,
            AppProperties appProperties) {
        this.eventLogRepository = eventLogRepository;
        this.eventPublisher = eventPublisher;
        this.transactionOperations = transactionOperations;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.appProperties = appProperties;
    }

    @Override
    public void append(UUID aggregateId, List<PostEvent> events, int expectedVersion) {
        log.debug("Appending {} events to post={} (expectedVersion={})", events.size(), aggregateId, expectedVersion);

        int currentVersion = eventLogRepository.findLastVersion(aggregateId).orElse(PostAggregate.NEW_VERSION);
        if (currentVersion != expectedVersion) {
            metrics.incrementConcurrencyConflicts();
            log.warn("Concurrency conflict on post={}: expectedVersion={}, currentVersion={}",
                aggregateId, expectedVersion, currentVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
        }

        if (events.isEmpty()) {
            return;
        }

        List<PostEvent> versioned = new ArrayList<>(events.size());
        int version = expectedVersion;
        for (PostEvent event : events) {
            versioned.add(event.withVersion(++version));
        }

        try {
            transactionOperations.executeWithoutResult(status -> versioned.forEach(event ->
                eventLogRepository.save(EventRecord.of(idGenerator.generate(), PostAggregate.AGGREGATE_TYPE, event))));
        } catch (ConcurrencyConflictException e) {
            metrics.incrementConcurrencyConflicts();
            int storedVersion = eventLogRepository.findLastVersion(aggregateId).orElse(PostAggregate.NEW_VERSION);
            log.warn("Lost append race on post={}: expectedVersion={}, currentVersion={}",
                aggregateId, expectedVersion, storedVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, storedVersion, e);
        }
        metrics.incrementEventsAppended(versioned.size());
        log.info("Stored {} events for post={}, versions {}..{}",
            versioned.size(), aggregateId, expectedVersion + 1, version);

        publishAll(aggregateId, versioned);
    }

    @Override
    public List<PostEvent> load(UUID aggregateId) {
        List<EventRecord> records = eventLogRepository.findByAggregateId(aggregateId);
        if (records.isEmpty()) {
            log.debug("No events found for post={}", aggregateId);
            throw new AggregateNotFoundException(aggregateId);
        }
        log.debug("Loaded {} events for post={}", records.size(), aggregateId);
        return records.stream()
            .map(EventRecord::event)
            .toList();
    }

    private void publishAll(UUID aggregateId, List<PostEvent> events) {
        String topic = appProperties.getKafka().getTopic();
        for (PostEvent event : events) {
            try {
                eventPublisher.publish(topic, event);
            } catch (RuntimeException e) {
                metrics.incrementPublishFailures();
                log.error("Failed to publish event: post={}, version={}, type={}",
                    aggregateId, event.version(), event.eventType().discriminator(), e);
                throw e instanceof PublishFailureException publishFailure
                    ? publishFailure
                    : new PublishFailureException(aggregateId, event.version(), e);
            }
        }
        log.debug("Published {} events for post={} to topic={}", events.size(), aggregateId, topic);
    }
}
