package com.socialpost.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.socialpost.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered ids for posts, comments and event records.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator;

    public UUIDv7Generator() {
        this.generator = Generators.timeBasedEpochGenerator();
    }

    @Override
    public UUID generate() {
        return generator.generate();
    }
}
