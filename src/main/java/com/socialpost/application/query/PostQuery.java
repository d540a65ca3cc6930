package com.socialpost.application.query;

/**
 * Closed family of read requests served by {@link QueryDispatcher}.
 */
public sealed interface PostQuery
    permits FindAllPostsQuery,
        FindPostByIdQuery,
        FindPostsByAuthorQuery,
        FindPostsWithCommentsQuery,
        FindPostsWithLikesQuery {
}
