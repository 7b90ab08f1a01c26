package com.vuong.resthandler.core.outcome;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of projected items with the link to the next page and, when requested,
 * the number of items matching the filters.
 * @param <T> the item type
 */
@Getter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PageResult<T> {

    private final List<T> items;
    private final String nextPageLink;
    private final Long count;

    public PageResult(List<T> items, String nextPageLink, Long count) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.nextPageLink = nextPageLink;
        this.count = count;
    }
}
