package com.vuong.resthandler.core.query;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Materialized result of applying {@link QueryOptions} to a {@link QuerySource}.
 * @param <T> the element type
 */
@Getter
@ToString
public final class QueryResult<T> {

    private final List<T> items;
    /** Number of elements matching the filters, before paging. */
    private final long totalCount;
    /** Whether rows remain after this page. */
    private final boolean hasMore;

    public QueryResult(List<T> items, long totalCount, boolean hasMore) {
        this.items = List.copyOf(items);
        this.totalCount = totalCount;
        this.hasMore = hasMore;
    }
}
