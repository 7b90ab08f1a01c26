package com.vuong.resthandler.core.query;

import com.vuong.resthandler.config.RestHandlerProperties;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.dto.ValidationFailure;
import com.vuong.resthandler.exception.ValidationException;
import com.vuong.resthandler.util.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw request parameters into {@link QueryOptions}.
 * <p>
 * {@code page} and {@code size} select the page, {@code sort} takes
 * {@code field[,asc|desc]} entries separated by {@code ;}, {@code count=true}
 * asks for the filtered total. Every other parameter is a filter.
 */
@Component
public class QueryOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptionsParser.class);

    public static final String PAGE = "page";
    public static final String SIZE = "size";
    public static final String SORT = "sort";
    public static final String COUNT = "count";

    private static final Set<String> RESERVED = Set.of(PAGE, SIZE, SORT, COUNT);

    private final RestHandlerProperties properties;
    private final InputSanitizer inputSanitizer;

    public QueryOptionsParser(RestHandlerProperties properties, InputSanitizer inputSanitizer) {
        this.properties = properties;
        this.inputSanitizer = inputSanitizer;
    }

    /**
     * Checks the paging, sorting and count parameters.
     * @param params the request parameters
     * @return the problems found, empty if the parameters are valid
     */
    public List<ValidationFailure> validate(Map<String, String> params) {
        List<ValidationFailure> failures = new ArrayList<>();
        if (params == null) {
            return failures;
        }

        String page = params.get(PAGE);
        if (page != null) {
            Integer value = parseInt(page);
            if (value == null) {
                failures.add(new ValidationFailure(PAGE, "Page number must be an integer", page));
            } else if (value < 0) {
                failures.add(new ValidationFailure(PAGE, "Page number cannot be negative", page));
            }
        }

        String size = params.get(SIZE);
        if (size != null) {
            Integer value = parseInt(size);
            if (value == null) {
                failures.add(new ValidationFailure(SIZE, "Page size must be an integer", size));
            } else if (value <= 0) {
                failures.add(new ValidationFailure(SIZE, "Page size must be positive", size));
            }
        }

        String sort = params.get(SORT);
        if (StringUtils.hasText(sort)) {
            for (String entry : sort.split(";")) {
                String[] parts = entry.split(",");
                if (parts.length == 0 || !StringUtils.hasText(parts[0]) || parts.length > 2
                        || (parts.length == 2 && Sort.Direction.fromOptionalString(parts[1].trim()).isEmpty())) {
                    failures.add(new ValidationFailure(SORT, "Sort must be field[,asc|desc]", sort));
                    break;
                }
            }
        }

        String count = params.get(COUNT);
        if (count != null && !"true".equalsIgnoreCase(count) && !"false".equalsIgnoreCase(count)) {
            failures.add(new ValidationFailure(COUNT, "Count must be true or false", count));
        }
        return failures;
    }

    /**
     * Parses the request parameters.
     * @param params the request parameters
     * @return the query options
     * @throws ValidationException if {@link #validate(Map)} reports any problem
     */
    public QueryOptions parse(Map<String, String> params) {
        List<ValidationFailure> failures = validate(params);
        if (!failures.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_QUERY_OPTION, failures);
        }
        Map<String, String> raw = params != null ? params : Map.of();

        // Remove paging params from filters
        Map<String, String> filters = new HashMap<>(raw);
        filters.keySet().removeAll(RESERVED);
        filters = inputSanitizer.sanitizeFilters(filters);
        filters.entrySet().removeIf(e -> !StringUtils.hasText(e.getKey()) || !StringUtils.hasText(e.getValue()));

        RestHandlerProperties.Paging paging = properties.getPaging();
        boolean explicitPaging = raw.containsKey(PAGE) || raw.containsKey(SIZE);
        int size = raw.containsKey(SIZE) ? Integer.parseInt(raw.get(SIZE).trim()) : paging.getDefaultSize();
        if (size > paging.getMaxSize()) {
            logger.debug("Clamping page size {} to {}", size, paging.getMaxSize());
            size = paging.getMaxSize();
        }

        QueryOptions options = QueryOptions.builder()
                .filters(filters)
                .sort(parseSort(raw.get(SORT)))
                .page(raw.containsKey(PAGE) ? Integer.parseInt(raw.get(PAGE).trim()) : 0)
                .size(size)
                .count(raw.containsKey(COUNT) ? Boolean.parseBoolean(raw.get(COUNT)) : paging.isCountByDefault())
                .explicitPaging(explicitPaging)
                .build();
        logger.debug("Parsed query options: {}", options);
        return options;
    }

    private Sort parseSort(String sort) {
        if (!StringUtils.hasText(sort)) {
            return Sort.unsorted();
        }
        List<Sort.Order> orders = new ArrayList<>();
        for (String entry : sort.split(";")) {
            String[] parts = entry.split(",");
            Sort.Direction direction = parts.length == 2
                    ? Sort.Direction.fromString(parts[1].trim())
                    : Sort.DEFAULT_DIRECTION;
            orders.add(new Sort.Order(direction, parts[0].trim()));
        }
        return Sort.by(orders);
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
