package com.socialpost.adapter.in.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialpost.domain.event.EventType;
import com.socialpost.domain.event.PostEvent;
import org.springframework.stereotype.Component;

/**
 * Turns a consumed JSON envelope into a typed event. The envelope carries a {@code type}
 * discriminator and a {@code version}; the discriminator is checked against the known
 * kinds before any kind-specific field is bound.
 */
@Component
public class EventEnvelopeDecoder {

    private final ObjectMapper objectMapper;

    public EventEnvelopeDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PostEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventException("Empty event payload");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event payload is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("Event payload is not a JSON object");
        }

        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            throw new MalformedEventException("Event payload has no textual 'type'");
        }
        JsonNode version = node.get("version");
        if (version == null || !version.isInt()) {
            throw new MalformedEventException("Event payload has no integer 'version'");
        }

        EventType eventType = EventType.fromDiscriminator(type.asText())
            .orElseThrow(() -> new UnrecognizedEventTypeException(type.asText()));

        try {
            PostEvent event = objectMapper.treeToValue(node, PostEvent.class);
            if (event == null || event.aggregateId() == null) {
                throw new MalformedEventException(eventType.discriminator() + " has no 'aggregateId'");
            }
            return event;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedEventException("Cannot bind " + eventType.discriminator() + ": " + e.getMessage(), e);
        }
    }
}
