package com.socialpost.application.service;

import com.socialpost.domain.error.AggregateNotFoundException;
import com.socialpost.domain.event.PostCreatedEvent;
import com.socialpost.domain.event.PostEvent;
import com.socialpost.domain.event.PostLikedEvent;
import com.socialpost.domain.model.PostAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PostEventSourcingHandler")
class PostEventSourcingHandlerTest {

    @Mock
    private EventStore eventStore;

    private PostEventSourcingHandler handler;
    private UUID postId;

    @BeforeEach
    void setUp() {
        handler = new PostEventSourcingHandler(eventStore, UUID::randomUUID);
        postId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Should rebuild a post from its stored events")
    void shouldRebuildPost() {
        when(eventStore.load(postId)).thenReturn(List.of(
            new PostCreatedEvent(postId, 0, "alice", "hello", Instant.now()),
            new PostLikedEvent(postId, 1)
        ));

        PostAggregate post = handler.getById(postId);

        assertEquals(1, post.getVersion());
        assertEquals(1, post.getLikes());
        assertEquals(0, post.getUncommittedCount());
    }

    @Test
    @DisplayName("Should propagate not found")
    void shouldPropagateNotFound() {
        when(eventStore.load(postId)).thenThrow(new AggregateNotFoundException(postId));

        assertThrows(AggregateNotFoundException.class, () -> handler.getById(postId));
    }

    @Test
    @DisplayName("Should save a new post against the new-version sentinel")
    @SuppressWarnings("unchecked")
    void shouldSaveNewPost() {
        PostAggregate post = PostAggregate.create(postId, "alice", "hello", UUID::randomUUID);

        handler.save(post);

        ArgumentCaptor<List<PostEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(eventStore).append(eq(postId), events.capture(), eq(PostAggregate.NEW_VERSION));
        assertEquals(1, events.getValue().size());
        assertEquals(0, post.getUncommittedCount());
    }

    @Test
    @DisplayName("Should save changes against the version the post was loaded at")
    void shouldSaveAgainstLoadedVersion() {
        when(eventStore.load(postId)).thenReturn(List.of(
            new PostCreatedEvent(postId, 0, "alice", "hello", Instant.now()),
            new PostLikedEvent(postId, 1)
        ));
        PostAggregate post = handler.getById(postId);
        post.like();
        post.addComment("nice", "bob");

        handler.save(post);

        verify(eventStore).append(eq(postId), argThat(list -> list.size() == 2), eq(1));
    }
}
