package com.socialpost.application.service;

import com.socialpost.application.port.out.IdGenerator;
import com.socialpost.domain.event.PostEvent;
import com.socialpost.domain.model.PostAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Loads posts by replaying their stream and saves them by appending what they buffered.
 */
@Service
public class PostEventSourcingHandler {

    private static final Logger log = LoggerFactory.getLogger(PostEventSourcingHandler.class);

    private final EventStore eventStore;
    private final IdGenerator idGenerator;

    public PostEventSourcingHandler(EventStore eventStore, IdGenerator idGenerator) {
        this.eventStore = eventStore;
        this.idGenerator = idGenerator;
    }

    public PostAggregate getById(UUID postId) {
        List<PostEvent> events = eventStore.load(postId);
        PostAggregate aggregate = new PostAggregate(idGenerator::generate);
        events.forEach(aggregate::applyForReplay);
        log.debug("Rehydrated post={} at version={}", postId, aggregate.getVersion());
        return aggregate;
    }

    public void save(PostAggregate aggregate) {
        // Version the aggregate had before the buffered events were raised
        int expectedVersion = aggregate.getVersion() - aggregate.getUncommittedCount();
        eventStore.append(aggregate.getId(), aggregate.drainUncommitted(), expectedVersion);
    }
}
