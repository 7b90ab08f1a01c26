package com.vuong.resthandler.core.query;

import java.util.Collection;

/**
 * A sequence that query options can be applied to.
 * Implementations never modify the underlying data.
 * @param <T> the element type
 */
@FunctionalInterface
public interface QuerySource<T> {

    /**
     * Applies filter, sort and paging, in that order, and materializes the result.
     * @param options the query options
     * @return the page of matching elements with the filtered total
     */
    QueryResult<T> fetch(QueryOptions options);

    static <T> QuerySource<T> of(Collection<? extends T> source) {
        return new InMemoryQuerySource<>(source);
    }

    static <T> QuerySource<T> of(Collection<? extends T> source, Class<T> elementType) {
        return new InMemoryQuerySource<>(source, elementType);
    }
}
