package com.socialpost.application.query;

public record FindPostsWithCommentsQuery() implements PostQuery {}
