package com.socialpost.application.service;

import com.socialpost.application.port.out.IdGenerator;
import com.socialpost.domain.model.PostAggregate;
import com.socialpost.domain.model.PostAggregateFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class DefaultPostAggregateFactory implements PostAggregateFactory {

    private final IdGenerator idGenerator;

    public DefaultPostAggregateFactory(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public PostAggregate create(UUID id, String author, String message) {
        return PostAggregate.create(id, author, message, idGenerator::generate);
    }
}
