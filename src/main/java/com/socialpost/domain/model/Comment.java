package com.socialpost.domain.model;

import java.util.UUID;

/**
 * Comment state held inside {@link PostAggregate}; never persisted on its own.
 */
public record Comment(
    UUID id,
    String username,
    String text,
    boolean edited
) {

    public boolean isOwnedBy(String requester) {
        return username.equals(requester);
    }

    public Comment edit(String newText) {
        return new Comment(id, username, newText, true);
    }
}
