package com.socialpost.application.query;

import java.util.UUID;

public record FindPostByIdQuery(UUID id) implements PostQuery {}
