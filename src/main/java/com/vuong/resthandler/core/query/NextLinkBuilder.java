package com.vuong.resthandler.core.query;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Builds the link to the page following the current one.
 */
@Component
public class NextLinkBuilder {

    /**
     * @param request the current request
     * @param options the options the result was fetched with
     * @param result the fetched page
     * @return the current request URL with the next page number, or null when no rows remain
     */
    public String build(HttpServletRequest request, QueryOptions options, QueryResult<?> result) {
        if (!options.isPaged() || !result.isHasMore()) {
            return null;
        }
        QueryOptions next = options.next();
        return ServletUriComponentsBuilder.fromRequest(request)
                .replaceQueryParam(QueryOptionsParser.PAGE, next.getPage())
                .replaceQueryParam(QueryOptionsParser.SIZE, next.getSize())
                .toUriString();
    }
}
