package com.socialpost.infrastructure.config;

import com.socialpost.application.query.FindAllPostsQuery;
import com.socialpost.application.query.FindPostByIdQuery;
import com.socialpost.application.query.FindPostsByAuthorQuery;
import com.socialpost.application.query.FindPostsWithCommentsQuery;
import com.socialpost.application.query.FindPostsWithLikesQuery;
import com.socialpost.application.query.QueryDispatcher;
import com.socialpost.application.service.PostQueryHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires every post query to its handler method. Runs once at startup.
 */
@Configuration
public class QueryDispatcherConfig {

    @Bean
    public QueryDispatcher queryDispatcher(PostQueryHandler handler) {
        QueryDispatcher dispatcher = new QueryDispatcher();
        dispatcher.registerHandler(FindAllPostsQuery.class, handler::handle);
        dispatcher.registerHandler(FindPostByIdQuery.class, handler::handle);
        dispatcher.registerHandler(FindPostsByAuthorQuery.class, handler::handle);
        dispatcher.registerHandler(FindPostsWithCommentsQuery.class, handler::handle);
        dispatcher.registerHandler(FindPostsWithLikesQuery.class, handler::handle);
        return dispatcher;
    }
}
