package com.socialpost.application.port.out;

import java.util.UUID;

/**
 * Port for generating post, comment and event record identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new unique identifier.
     * Implementations should ensure time-ordering (e.g., UUIDv7).
     */
    UUID generate();
}
