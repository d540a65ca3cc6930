package com.socialpost.application.service;

import com.socialpost.application.port.out.PostViewRepository;
import com.socialpost.application.query.FindAllPostsQuery;
import com.socialpost.application.query.FindPostByIdQuery;
import com.socialpost.application.query.FindPostsByAuthorQuery;
import com.socialpost.application.query.FindPostsWithCommentsQuery;
import com.socialpost.application.query.FindPostsWithLikesQuery;
import com.socialpost.domain.readmodel.PostView;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PostQueryHandler {

    private final PostViewRepository postRepository;

    public PostQueryHandler(PostViewRepository postRepository) {
        this.postRepository = postRepository;
    }

    public List<PostView> handle(FindAllPostsQuery query) {
        return postRepository.listAll();
    }

    /**
     * Returns a list holding the post, or an empty list if it is not (yet) in the read model.
     */
    public List<PostView> handle(FindPostByIdQuery query) {
        return postRepository.findById(query.id())
            .map(List::of)
            .orElse(List.of());
    }

    public List<PostView> handle(FindPostsByAuthorQuery query) {
        return postRepository.listByAuthor(query.author());
    }

    public List<PostView> handle(FindPostsWithCommentsQuery query) {
        return postRepository.listWithComments();
    }

    public List<PostView> handle(FindPostsWithLikesQuery query) {
        return postRepository.listWithLikesAtLeast(query.numberOfLikes());
    }
}
