package com.vuong.resthandler.core.query;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filter, sort, paging and count directives applied to a query source.
 * Instances are immutable and request-scoped.
 */
@Getter
@ToString
public final class QueryOptions {

    /** Filter key matching any String field of the element. */
    public static final String SEARCH_KEY = "search";

    private final Map<String, String> filters;
    private final Sort sort;
    private final int page;
    /** Page size, or null when the whole filtered set is returned. */
    private final Integer size;
    /** Whether the total filtered count is reported. */
    private final boolean count;
    /** Whether the caller asked for a page explicitly rather than getting the default size. */
    private final boolean explicitPaging;

    @Builder(toBuilder = true)
    private QueryOptions(Map<String, String> filters, Sort sort, int page, Integer size, boolean count,
                         boolean explicitPaging) {
        if (page < 0) {
            throw new IllegalArgumentException("Page number cannot be negative");
        }
        if (size != null && size <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.filters = filters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        this.sort = sort == null ? Sort.unsorted() : sort;
        this.page = page;
        this.size = size;
        this.count = count;
        this.explicitPaging = explicitPaging;
    }

    /**
     * @return options without filters, sorting or paging
     */
    public static QueryOptions unpaged() {
        return builder().build();
    }

    public static QueryOptions of(int page, int size) {
        return builder().page(page).size(size).explicitPaging(true).build();
    }

    public boolean isPaged() {
        return size != null;
    }

    public long getOffset() {
        return isPaged() ? (long) page * size : 0L;
    }

    public boolean hasFilters() {
        return !filters.isEmpty();
    }

    /**
     * @return a copy of these options that returns the whole filtered and sorted set
     */
    public QueryOptions withoutPaging() {
        return toBuilder().page(0).size(null).explicitPaging(false).build();
    }

    /**
     * @return the options for the following page
     * @throws IllegalStateException if these options are not paged
     */
    public QueryOptions next() {
        if (!isPaged()) {
            throw new IllegalStateException("Unpaged options have no next page");
        }
        return toBuilder().page(page + 1).build();
    }

    public Pageable toPageable() {
        return isPaged() ? PageRequest.of(page, size, sort) : Pageable.unpaged(sort);
    }
}
