package com.socialpost.application.port.out;

import com.socialpost.domain.event.PostEvent;

public interface EventPublisher {

    /**
     * Publishes the event and waits for the broker to acknowledge it.
     *
     * @throws com.socialpost.application.service.PublishFailureException if the broker did not accept it
     */
    void publish(String topic, PostEvent event);
}
