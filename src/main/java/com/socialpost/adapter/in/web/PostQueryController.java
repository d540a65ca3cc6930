package com.socialpost.adapter.in.web;

import com.socialpost.application.port.in.QueryPostsUseCase;
import com.socialpost.application.query.FindAllPostsQuery;
import com.socialpost.application.query.FindPostByIdQuery;
import com.socialpost.application.query.FindPostsByAuthorQuery;
import com.socialpost.application.query.FindPostsWithCommentsQuery;
import com.socialpost.application.query.FindPostsWithLikesQuery;
import com.socialpost.application.query.PostQuery;
import com.socialpost.domain.readmodel.PostView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-side endpoints. All answer 200 with a list, or 204 when nothing matches.
 */
@RestController
@RequestMapping("/api/v1/posts")
@Tag(name = "Post queries", description = "Read posts from the projected read model")
public class PostQueryController {

    private final QueryPostsUseCase queryUseCase;

    public PostQueryController(QueryPostsUseCase queryUseCase) {
        this.queryUseCase = queryUseCase;
    }

    @GetMapping
    @Operation(summary = "List all posts")
    public ResponseEntity<List<PostView>> getAllPosts() {
        return respond(new FindAllPostsQuery());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a post by id")
    public ResponseEntity<List<PostView>> getPostById(@PathVariable UUID id) {
        return respond(new FindPostByIdQuery(id));
    }

    @GetMapping("/by-author/{author}")
    @Operation(summary = "List posts whose author contains the given text")
    public ResponseEntity<List<PostView>> getPostsByAuthor(
            @Parameter(description = "Author name or part of it", example = "ali")
            @PathVariable String author) {
        return respond(new FindPostsByAuthorQuery(author));
    }

    @GetMapping("/with-comments")
    @Operation(summary = "List posts that have at least one comment")
    public ResponseEntity<List<PostView>> getPostsWithComments() {
        return respond(new FindPostsWithCommentsQuery());
    }

    @GetMapping("/with-likes/{numberOfLikes}")
    @Operation(summary = "List posts with at least the given number of likes")
    public ResponseEntity<List<PostView>> getPostsWithLikes(@PathVariable int numberOfLikes) {
        return respond(new FindPostsWithLikesQuery(numberOfLikes));
    }

    private ResponseEntity<List<PostView>> respond(PostQuery query) {
        List<PostView> posts = queryUseCase.send(query);
        return posts.isEmpty() ? ResponseEntity.noContent().build() : ResponseEntity.ok(posts);
    }
}
