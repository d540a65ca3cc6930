package com.socialpost.adapter.in.messaging;

public class UnrecognizedEventTypeException extends RuntimeException {

    private final String eventType;

    public UnrecognizedEventTypeException(String eventType) {
        super("Unrecognized event type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
