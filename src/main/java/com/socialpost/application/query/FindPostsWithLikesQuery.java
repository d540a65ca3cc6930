package com.socialpost.application.query;

public record FindPostsWithLikesQuery(int numberOfLikes) implements PostQuery {}
