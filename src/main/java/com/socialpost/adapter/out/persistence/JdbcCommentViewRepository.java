package com.socialpost.adapter.out.persistence;

import com.socialpost.application.port.out.CommentViewRepository;
import com.socialpost.domain.readmodel.CommentView;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Each write first advances the owning post's {@code last_version} and only touches the
 * comment if that succeeded, all in one statement.
 */
@Repository
public class JdbcCommentViewRepository implements CommentViewRepository {

    static final RowMapper<CommentView> ROW_MAPPER = (rs, rowNum) -> new CommentView(
        rs.getObject("comment_id", UUID.class),
        rs.getObject("post_id", UUID.class),
        rs.getString("username"),
        rs.getString("comment"),
        rs.getTimestamp("comment_date").toInstant(),
        rs.getBoolean("edited")
    );

    private final JdbcTemplate jdbc;

    public JdbcCommentViewRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean create(CommentView comment, int version) {
        return jdbc.update("""
            WITH bumped AS (
                UPDATE posts SET last_version = ? WHERE post_id = ? AND last_version < ? RETURNING post_id
            )
            INSERT INTO comments (comment_id, post_id, username, comment, comment_date, edited)
            SELECT ?::uuid, post_id, ?::varchar, ?::text, ?::timestamptz, FALSE FROM bumped
            ON CONFLICT (comment_id) DO NOTHING
            """,
            version, comment.postId(), version,
            comment.commentId(),
            comment.username(),
            comment.comment(),
            Timestamp.from(comment.commentDate())
        ) > 0;
    }

    @Override
    public boolean update(UUID postId, UUID commentId, String comment, Instant editDate, int version) {
        return jdbc.update("""
            WITH bumped AS (
                UPDATE posts SET last_version = ? WHERE post_id = ? AND last_version < ? RETURNING post_id
            )
            UPDATE comments c SET comment = ?, comment_date = ?, edited = TRUE
            FROM bumped
            WHERE c.comment_id = ? AND c.post_id = bumped.post_id
            """,
            version, postId, version,
            comment,
            Timestamp.from(editDate),
            commentId
        ) > 0;
    }

    @Override
    public boolean delete(UUID postId, UUID commentId, int version) {
        return jdbc.update("""
            WITH bumped AS (
                UPDATE posts SET last_version = ? WHERE post_id = ? AND last_version < ? RETURNING post_id
            )
            DELETE FROM comments c
            USING bumped
            WHERE c.comment_id = ? AND c.post_id = bumped.post_id
            """,
            version, postId, version,
            commentId
        ) > 0;
    }

    @Override
    public Optional<CommentView> findById(UUID commentId) {
        return jdbc.query(
            "SELECT comment_id, post_id, username, comment, comment_date, edited FROM comments WHERE comment_id = ?",
            ROW_MAPPER,
            commentId
        ).stream().findFirst();
    }
}
