package com.socialpost.application.query;

public record FindAllPostsQuery() implements PostQuery {}
