package com.socialpost.application.port.in;

import com.socialpost.application.query.PostQuery;
import com.socialpost.domain.readmodel.PostView;

import java.util.List;

public interface QueryPostsUseCase {
    List<PostView> send(PostQuery query);
}
