package com.socialpost.adapter.in.web;

import com.socialpost.application.command.AddCommentCommand;
import com.socialpost.application.command.DeletePostCommand;
import com.socialpost.application.command.EditCommentCommand;
import com.socialpost.application.command.EditMessageCommand;
import com.socialpost.application.command.LikePostCommand;
import com.socialpost.application.command.NewPostCommand;
import com.socialpost.application.command.RemoveCommentCommand;
import com.socialpost.application.port.in.SendPostCommandUseCase;
import com.socialpost.application.port.out.IdGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/posts")
@Tag(name = "Post commands", description = "Create and change posts and their comments")
public class PostCommandController {

    private static final String USERNAME_HEADER = "X-Username";

    private final SendPostCommandUseCase commandUseCase;
    private final IdGenerator idGenerator;

    public PostCommandController(SendPostCommandUseCase commandUseCase, IdGenerator idGenerator) {
        this.commandUseCase = commandUseCase;
        this.idGenerator = idGenerator;
    }

    @PostMapping
    @Operation(summary = "Create a post", description = "Creates a post authored by the requester")
    public ResponseEntity<NewPostResponse> newPost(
            @Parameter(description = "Requester", example = "alice")
            @RequestHeader(USERNAME_HEADER) String username,
            @Valid @RequestBody MessageRequest request) {
        UUID postId = idGenerator.generate();
        commandUseCase.send(new NewPostCommand(postId, username, request.message()));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new NewPostResponse(postId, "New post creation request completed successfully"));
    }

    @PutMapping("/{id}/message")
    @Operation(summary = "Edit a post's message", description = "Only the author may edit")
    public ResponseEntity<MessageResponse> editMessage(
            @RequestHeader(USERNAME_HEADER) String username,
            @PathVariable UUID id,
            @Valid @RequestBody MessageRequest request) {
        commandUseCase.send(new EditMessageCommand(id, request.message(), username));
        return ok("Edit message request completed successfully");
    }

    @PutMapping("/{id}/like")
    @Operation(summary = "Like a post")
    public ResponseEntity<MessageResponse> likePost(@PathVariable UUID id) {
        commandUseCase.send(new LikePostCommand(id));
        return ok("Like post request completed successfully");
    }

    @PostMapping("/{id}/comments")
    @Operation(summary = "Comment on a post")
    public ResponseEntity<MessageResponse> addComment(
            @RequestHeader(USERNAME_HEADER) String username,
            @PathVariable UUID id,
            @Valid @RequestBody CommentRequest request) {
        commandUseCase.send(new AddCommentCommand(id, request.comment(), username));
        return ok("Add comment request completed successfully");
    }

    @PutMapping("/{id}/comments/{commentId}")
    @Operation(summary = "Edit a comment", description = "Only the comment's owner may edit")
    public ResponseEntity<MessageResponse> editComment(
            @RequestHeader(USERNAME_HEADER) String username,
            @PathVariable UUID id,
            @PathVariable UUID commentId,
            @Valid @RequestBody CommentRequest request) {
        commandUseCase.send(new EditCommentCommand(id, commentId, request.comment(), username));
        return ok("Edit comment request completed successfully");
    }

    @DeleteMapping("/{id}/comments/{commentId}")
    @Operation(summary = "Remove a comment", description = "Only the comment's owner may remove")
    public ResponseEntity<MessageResponse> removeComment(
            @RequestHeader(USERNAME_HEADER) String username,
            @PathVariable UUID id,
            @PathVariable UUID commentId) {
        commandUseCase.send(new RemoveCommentCommand(id, commentId, username));
        return ok("Remove comment request completed successfully");
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a post", description = "Only the author may delete")
    public ResponseEntity<MessageResponse> deletePost(
            @RequestHeader(USERNAME_HEADER) String username,
            @PathVariable UUID id) {
        commandUseCase.send(new DeletePostCommand(id, username));
        return ok("Delete post request completed successfully");
    }

    private static ResponseEntity<MessageResponse> ok(String message) {
        return ResponseEntity.ok(new MessageResponse(message));
    }

    public record MessageRequest(@NotBlank String message) {}

    public record CommentRequest(@NotBlank String comment) {}

    public record NewPostResponse(UUID id, String message) {}

    public record MessageResponse(String message) {}
}
