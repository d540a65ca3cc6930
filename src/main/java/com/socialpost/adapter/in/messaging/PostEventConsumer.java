package com.socialpost.adapter.in.messaging;

import com.socialpost.application.port.out.BrokerReader.BrokerMessage;
import com.socialpost.application.port.out.MetricsPort;
import com.socialpost.application.service.PostEventProjector;
import com.socialpost.domain.event.PostEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Decodes a consumed message and applies it to the read model.
 */
@Component
public class PostEventConsumer implements MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PostEventConsumer.class);

    private final EventEnvelopeDecoder decoder;
    private final PostEventProjector projector;
    private final MetricsPort metrics;

    public PostEventConsumer(EventEnvelopeDecoder decoder, PostEventProjector projector, MetricsPort metrics) {
        this.decoder = decoder;
        this.projector = projector;
        this.metrics = metrics;
    }

    @Override
    public void process(BrokerMessage message) {
        metrics.recordProjectionDuration(() -> {
            PostEvent event = decoder.decode(message.payload());
            MDC.put("eventType", event.eventType().discriminator());
            MDC.put("aggregateId", event.aggregateId().toString());
            try {
                log.debug("Received event: type={}, post={}, version={}, offset={}",
                    event.eventType().discriminator(), event.aggregateId(), event.version(), message.offset());
                event.accept(projector);
            } finally {
                MDC.remove("eventType");
                MDC.remove("aggregateId");
            }
        });
        metrics.incrementEventsProjected();
    }
}
