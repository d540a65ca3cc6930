package com.socialpost.adapter.out.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.socialpost.application.port.out.EventPublisher;
import com.socialpost.application.service.PublishFailureException;
import com.socialpost.domain.event.PostEvent;
import com.socialpost.infrastructure.config.AppProperties;
import com.socialpost.infrastructure.context.RequestContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes events as JSON envelopes keyed by post id, so all events of one post land on
 * the same partition in version order.
 */
@Component
public class KafkaEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectWriter eventWriter;
    private final AppProperties appProperties;

    public KafkaEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            AppProperties appProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.eventWriter = objectMapper.writerFor(PostEvent.class);
        this.appProperties = appProperties;
    }

    @Override
    public void publish(String topic, PostEvent event) {
        String payload;
        try {
            payload = eventWriter.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new PublishFailureException(event.aggregateId(), event.version(), e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(
            topic,
            null,
            event.aggregateId().toString(),
            payload
        );
        String eventType = event.eventType().discriminator();
        record.headers().add(new RecordHeader("eventType", eventType.getBytes(StandardCharsets.UTF_8)));
        String requestId = RequestContext.getRequestId();
        if (requestId != null) {
            record.headers().add(new RecordHeader("requestId", requestId.getBytes(StandardCharsets.UTF_8)));
        }

        try {
            kafkaTemplate.send(record).get(appProperties.getKafka().getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishFailureException(event.aggregateId(), event.version(), e);
        } catch (ExecutionException e) {
            throw new PublishFailureException(event.aggregateId(), event.version(), e.getCause());
        } catch (TimeoutException | RuntimeException e) {
            throw new PublishFailureException(event.aggregateId(), event.version(), e);
        }
        log.debug("Published event: type={}, post={}, version={}", eventType, event.aggregateId(), event.version());
    }
}
