package com.socialpost.application.query;

public record FindPostsByAuthorQuery(String author) implements PostQuery {}
