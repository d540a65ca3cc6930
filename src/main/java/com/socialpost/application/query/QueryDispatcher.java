package com.socialpost.application.query;

import com.socialpost.application.port.in.QueryPostsUseCase;
import com.socialpost.domain.readmodel.PostView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Routes each query to the single handler registered for its concrete type.
 */
public class QueryDispatcher implements QueryPostsUseCase {

    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

    private final Map<Class<? extends PostQuery>, Function<PostQuery, List<PostView>>> handlers =
        new ConcurrentHashMap<>();

    /**
     * @throws DuplicateHandlerRegistrationException if a handler is already bound to the query type
     */
    public <Q extends PostQuery> void registerHandler(Class<Q> queryType, Function<Q, List<PostView>> handler) {
        Function<PostQuery, List<PostView>> erased = query -> handler.apply(queryType.cast(query));
        if (handlers.putIfAbsent(queryType, erased) != null) {
            throw new DuplicateHandlerRegistrationException(queryType);
        }
        log.debug("Registered query handler for {}", queryType.getSimpleName());
    }

    /**
     * @throws QueryHandlerNotFoundException if nothing is registered for the query's type
     */
    @Override
    public List<PostView> send(PostQuery query) {
        Function<PostQuery, List<PostView>> handler = handlers.get(query.getClass());
        if (handler == null) {
            throw new QueryHandlerNotFoundException(query.getClass());
        }
        log.debug("Dispatching query {}", query);
        return handler.apply(query);
    }
}
