package com.socialpost.integration.e2e;

import com.socialpost.adapter.out.persistence.JdbcEventLogRepository;
import com.socialpost.integration.base.FullStackTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API end to end: commands go through the event log and the broker,
 * and the assertions wait for the projected read model to catch up.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@EnabledIf("isDockerAvailable")
@DisplayName("Post Lifecycle E2E Tests")
@SuppressWarnings("unchecked")
class PostLifecycleIntegrationTest extends FullStackTestBase {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcEventLogRepository eventLogRepository;

    @Test
    @DisplayName("Create, like, comment, edit and delete a post")
    void completePostLifecycle() {
        // === Step 1: cesar creates a post ===
        UUID postId = createPost("cesar", "hello world");

        Map<String, Object> post = awaitPost(postId, p -> assertEquals("hello world", p.get("message")));
        assertEquals("cesar", post.get("author"));
        assertEquals(0, post.get("likes"));

        // === Step 2: two likes and a comment from user1 ===
        assertEquals(HttpStatus.OK, exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/like", "bob", null).getStatusCode());
        assertEquals(HttpStatus.OK, exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/like", "bob", null).getStatusCode());
        assertEquals(HttpStatus.OK, exchange(HttpMethod.POST, "/api/v1/posts/" + postId + "/comments", "user1",
            Map.of("comment", "nice post!")).getStatusCode());

        post = awaitPost(postId, p -> {
            assertEquals(2, p.get("likes"));
            assertEquals(1, ((List<?>) p.get("comments")).size());
        });
        Map<String, Object> comment = ((List<Map<String, Object>>) post.get("comments")).get(0);
        UUID commentId = UUID.fromString((String) comment.get("commentId"));
        assertEquals("user1", comment.get("username"));

        // === Step 3: user1 edits the comment, cesar edits the message ===
        exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/comments/" + commentId, "user1",
            Map.of("comment", "even better"));
        exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/message", "cesar", Map.of("message", "hello again"));

        awaitPost(postId, p -> {
            assertEquals("hello again", p.get("message"));
            Map<String, Object> edited = ((List<Map<String, Object>>) p.get("comments")).get(0);
            assertEquals("even better", edited.get("comment"));
            assertEquals(true, edited.get("edited"));
        });

        // === Step 4: the post is listed by author and by likes ===
        ResponseEntity<List> byAuthor = restTemplate.getForEntity("/api/v1/posts/by-author/cesar", List.class);
        assertEquals(HttpStatus.OK, byAuthor.getStatusCode());
        ResponseEntity<List> withComments = restTemplate.getForEntity("/api/v1/posts/with-comments", List.class);
        assertEquals(HttpStatus.OK, withComments.getStatusCode());

        // === Step 5: cesar deletes the post ===
        assertEquals(HttpStatus.OK, exchange(HttpMethod.DELETE, "/api/v1/posts/" + postId, "cesar", null).getStatusCode());

        await().atMost(15, TimeUnit.SECONDS).untilAsserted(() ->
            assertEquals(HttpStatus.NO_CONTENT,
                restTemplate.getForEntity("/api/v1/posts/" + postId, String.class).getStatusCode()));

        // like, like, comment, edit comment, edit message, delete
        assertEquals(6, eventLogRepository.findLastVersion(postId).getAsInt());
    }

    @Test
    @DisplayName("Reject commands that break the post's rules")
    void rejectInvalidCommands() {
        UUID postId = createPost("cesar", "hello world");

        ResponseEntity<Map> notAuthor = exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/message", "mallory",
            Map.of("message", "hijacked"));
        assertEquals(HttpStatus.FORBIDDEN, notAuthor.getStatusCode());
        assertEquals("NOT_AUTHORIZED", notAuthor.getBody().get("error"));

        ResponseEntity<Map> unknown = exchange(HttpMethod.PUT, "/api/v1/posts/" + UUID.randomUUID() + "/like", "bob", null);
        assertEquals(HttpStatus.NOT_FOUND, unknown.getStatusCode());

        ResponseEntity<Map> anonymous = exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/like", null, null);
        assertEquals(HttpStatus.UNAUTHORIZED, anonymous.getStatusCode());

        exchange(HttpMethod.DELETE, "/api/v1/posts/" + postId, "cesar", null);
        ResponseEntity<Map> afterDelete = exchange(HttpMethod.PUT, "/api/v1/posts/" + postId + "/like", "bob", null);
        assertEquals(HttpStatus.CONFLICT, afterDelete.getStatusCode());

        assertEquals(1, eventLogRepository.findLastVersion(postId).getAsInt());
    }

    private UUID createPost(String author, String message) {
        ResponseEntity<Map> response = exchange(HttpMethod.POST, "/api/v1/posts", author, Map.of("message", message));
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        return UUID.fromString((String) response.getBody().get("id"));
    }

    private Map<String, Object> awaitPost(UUID postId, Consumer<Map<String, Object>> assertion) {
        Map<String, Object>[] holder = new Map[1];
        await().atMost(15, TimeUnit.SECONDS).untilAsserted(() -> {
            ResponseEntity<List> response = restTemplate.getForEntity("/api/v1/posts/" + postId, List.class);
            assertEquals(HttpStatus.OK, response.getStatusCode());
            Map<String, Object> post = (Map<String, Object>) response.getBody().get(0);
            assertion.accept(post);
            holder[0] = post;
        });
        return holder[0];
    }

    private ResponseEntity<Map> exchange(HttpMethod method, String path, String username, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (username != null) {
            headers.set("X-Username", username);
        }
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), Map.class);
    }
}
