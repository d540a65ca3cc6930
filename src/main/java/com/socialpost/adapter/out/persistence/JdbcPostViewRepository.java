package com.socialpost.adapter.out.persistence;

import com.socialpost.application.port.out.PostViewRepository;
import com.socialpost.domain.readmodel.CommentView;
import com.socialpost.domain.readmodel.PostView;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class JdbcPostViewRepository implements PostViewRepository {

    private static final String SELECT_POSTS =
        "SELECT p.post_id, p.author, p.message, p.date_posted, p.likes FROM posts p";

    private static final String ORDER = " ORDER BY p.date_posted, p.post_id";

    private static final RowMapper<PostView> ROW_MAPPER = (rs, rowNum) -> new PostView(
        rs.getObject("post_id", UUID.class),
        rs.getString("author"),
        rs.getString("message"),
        rs.getTimestamp("date_posted").toInstant(),
        rs.getInt("likes"),
        List.of()
    );

    private final JdbcTemplate jdbc;

    public JdbcPostViewRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean create(PostView post, int version) {
        return jdbc.update("""
            INSERT INTO posts (post_id, author, message, date_posted, likes, last_version)
            VALUES (?, ?, ?, ?, 0, ?)
            ON CONFLICT (post_id) DO NOTHING
            """,
            post.postId(),
            post.author(),
            post.message(),
            Timestamp.from(post.datePosted()),
            version
        ) > 0;
    }

    @Override
    public boolean updateMessage(UUID postId, String message, int version) {
        return jdbc.update(
            "UPDATE posts SET message = ?, last_version = ? WHERE post_id = ? AND last_version < ?",
            message, version, postId, version
        ) > 0;
    }

    @Override
    public boolean incrementLikes(UUID postId, int version) {
        return jdbc.update(
            "UPDATE posts SET likes = likes + 1, last_version = ? WHERE post_id = ? AND last_version < ?",
            version, postId, version
        ) > 0;
    }

    @Override
    public boolean delete(UUID postId, int version) {
        // comments go with the post (ON DELETE CASCADE)
        return jdbc.update(
            "DELETE FROM posts WHERE post_id = ? AND last_version < ?",
            postId, version
        ) > 0;
    }

    @Override
    public Optional<PostView> findById(UUID postId) {
        return withComments(jdbc.query(SELECT_POSTS + " WHERE p.post_id = ?", ROW_MAPPER, postId))
            .stream().findFirst();
    }

    @Override
    public List<PostView> listAll() {
        return withComments(jdbc.query(SELECT_POSTS + ORDER, ROW_MAPPER));
    }

    @Override
    public List<PostView> listByAuthor(String author) {
        return withComments(jdbc.query(
            SELECT_POSTS + " WHERE strpos(p.author, ?) > 0" + ORDER,
            ROW_MAPPER,
            author
        ));
    }

    @Override
    public List<PostView> listWithComments() {
        return withComments(jdbc.query(
            SELECT_POSTS + " WHERE EXISTS (SELECT 1 FROM comments c WHERE c.post_id = p.post_id)" + ORDER,
            ROW_MAPPER
        ));
    }

    @Override
    public List<PostView> listWithLikesAtLeast(int numberOfLikes) {
        return withComments(jdbc.query(SELECT_POSTS + " WHERE p.likes >= ?" + ORDER, ROW_MAPPER, numberOfLikes));
    }

    private List<PostView> withComments(List<PostView> posts) {
        if (posts.isEmpty()) {
            return posts;
        }

        String placeholders = String.join(",", Collections.nCopies(posts.size(), "?"));
        Object[] params = posts.stream().map(PostView::postId).toArray();
        Map<UUID, List<CommentView>> byPost = jdbc.query(
            "SELECT comment_id, post_id, username, comment, comment_date, edited FROM comments"
                + " WHERE post_id IN (" + placeholders + ") ORDER BY comment_date, comment_id",
            JdbcCommentViewRepository.ROW_MAPPER,
            params
        ).stream().collect(Collectors.groupingBy(CommentView::postId, LinkedHashMap::new, Collectors.toList()));

        return posts.stream()
            .map(post -> post.withComments(byPost.getOrDefault(post.postId(), List.of())))
            .toList();
    }
}
