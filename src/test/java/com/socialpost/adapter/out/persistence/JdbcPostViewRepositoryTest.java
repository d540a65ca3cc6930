package com.socialpost.adapter.out.persistence;

import com.socialpost.domain.readmodel.CommentView;
import com.socialpost.domain.readmodel.PostView;
import com.socialpost.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "app.consumer.enabled=false")
@EnabledIf("isDockerAvailable")
class JdbcPostViewRepositoryTest extends FullStackTestBase {

    @Autowired
    private JdbcPostViewRepository posts;

    @Autowired
    private JdbcCommentViewRepository comments;

    private Instant now;

    @BeforeEach
    void setUp() {
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private UUID createPost(String author, String message, Instant datePosted) {
        UUID postId = UUID.randomUUID();
        assertTrue(posts.create(PostView.created(postId, author, message, datePosted), 0));
        return postId;
    }

    @Nested
    @DisplayName("Versioned writes")
    class VersionedWrites {

        @Test
        @DisplayName("Should create a post once and ignore a replayed creation")
        void shouldIgnoreReplayedCreation() {
            UUID postId = createPost("cesar", "hello world", now);

            assertFalse(posts.create(PostView.created(postId, "cesar", "other", now), 0));
            assertEquals("hello world", posts.findById(postId).orElseThrow().message());
        }

        @Test
        @DisplayName("Should apply message edits only for newer versions")
        void shouldApplyMessageEditOnlyForNewerVersion() {
            UUID postId = createPost("cesar", "hello world", now);

            assertTrue(posts.updateMessage(postId, "edited", 1));
            assertFalse(posts.updateMessage(postId, "stale", 1));

            assertEquals("edited", posts.findById(postId).orElseThrow().message());
        }

        @Test
        @DisplayName("Should count each like version once")
        void shouldCountEachLikeOnce() {
            UUID postId = createPost("cesar", "hello world", now);

            assertTrue(posts.incrementLikes(postId, 1));
            assertFalse(posts.incrementLikes(postId, 1));
            assertTrue(posts.incrementLikes(postId, 2));

            assertEquals(2, posts.findById(postId).orElseThrow().likes());
        }

        @Test
        @DisplayName("Should delete the post and its comments")
        void shouldDeletePostAndComments() {
            UUID postId = createPost("cesar", "hello world", now);
            UUID commentId = UUID.randomUUID();
            comments.create(new CommentView(commentId, postId, "user1", "nice", now, false), 1);

            assertTrue(posts.delete(postId, 2));

            assertTrue(posts.findById(postId).isEmpty());
            assertTrue(comments.findById(commentId).isEmpty());
        }

        @Test
        @DisplayName("Should report no change for an unknown post")
        void shouldReportNoChangeForUnknownPost() {
            assertFalse(posts.incrementLikes(UUID.randomUUID(), 1));
            assertFalse(posts.delete(UUID.randomUUID(), 1));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Should list all posts oldest first with their comments")
        void shouldListAllWithComments() {
            UUID older = createPost("cesar", "first", now.minusSeconds(60));
            UUID newer = createPost("alice", "second", now);
            UUID commentId = UUID.randomUUID();
            comments.create(new CommentView(commentId, newer, "user1", "nice", now, false), 1);

            List<PostView> result = posts.listAll();

            assertEquals(List.of(older, newer), result.stream().map(PostView::postId).toList());
            assertTrue(result.get(0).comments().isEmpty());
            assertEquals(commentId, result.get(1).comments().get(0).commentId());
        }

        @Test
        @DisplayName("Should match authors by substring")
        void shouldMatchAuthorsBySubstring() {
            UUID alice = createPost("alice", "one", now);
            createPost("bob", "two", now);

            List<PostView> result = posts.listByAuthor("lic");

            assertEquals(List.of(alice), result.stream().map(PostView::postId).toList());
        }

        @Test
        @DisplayName("Should list only posts that have comments")
        void shouldListOnlyCommentedPosts() {
            createPost("cesar", "quiet", now);
            UUID commented = createPost("cesar", "busy", now);
            comments.create(new CommentView(UUID.randomUUID(), commented, "user1", "hi", now, false), 1);

            List<PostView> result = posts.listWithComments();

            assertEquals(1, result.size());
            assertEquals(commented, result.get(0).postId());
            assertEquals(1, result.get(0).comments().size());
        }

        @Test
        @DisplayName("Should filter by minimum likes inclusively")
        void shouldFilterByMinimumLikes() {
            UUID popular = createPost("cesar", "popular", now);
            UUID ignored = createPost("cesar", "ignored", now);
            posts.incrementLikes(popular, 1);
            posts.incrementLikes(popular, 2);
            posts.incrementLikes(ignored, 1);

            assertEquals(List.of(popular), posts.listWithLikesAtLeast(2).stream().map(PostView::postId).toList());
            assertEquals(2, posts.listWithLikesAtLeast(0).size());
        }
    }
}
