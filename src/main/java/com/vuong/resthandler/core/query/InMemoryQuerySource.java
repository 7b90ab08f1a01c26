package com.vuong.resthandler.core.query;

import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.util.StringUtils;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Query source over an in-memory collection. Filtering mirrors
 * {@link com.vuong.resthandler.core.domain.specification.SpecificationBuilder}:
 * {@code search} matches any String field, String fields match by substring
 * (case-insensitive), {@code <relation>Id}/{@code <relation>Ids} match related
 * ids, other fields match by equality. Unknown filter keys and values that cannot
 * be converted are ignored. Sorting on an unknown property is a business fault,
 * checked against the element type when one is given and otherwise against the
 * first matching element.
 * @param <T> the element type
 */
public class InMemoryQuerySource<T> implements QuerySource<T> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryQuerySource.class);

    private final Collection<? extends T> source;
    private final Class<T> elementType;

    public InMemoryQuerySource(Collection<? extends T> source) {
        this(source, null);
    }

    /**
     * @param source the elements to query
     * @param elementType the declared element type, lets sort properties be checked on empty collections
     */
    public InMemoryQuerySource(Collection<? extends T> source, Class<T> elementType) {
        this.source = Objects.requireNonNull(source, "source");
        this.elementType = elementType;
    }

    @Override
    public QueryResult<T> fetch(QueryOptions options) {
        List<T> filtered = new ArrayList<>(source.size());
        for (T element : source) {
            if (element != null && matches(element, options.getFilters())) {
                filtered.add(element);
            }
        }

        if (options.getSort().isSorted()) {
            Class<?> type = elementType != null ? elementType
                    : filtered.isEmpty() ? null : filtered.get(0).getClass();
            if (type != null) {
                validateSort(options.getSort(), type);
            }
            filtered.sort(comparator(options.getSort()));
        }

        long total = filtered.size();
        if (!options.isPaged()) {
            return new QueryResult<>(filtered, total, false);
        }

        int from = (int) Math.min(options.getOffset(), total);
        int to = (int) Math.min((long) from + options.getSize(), total);
        return new QueryResult<>(filtered.subList(from, to), total, to < total);
    }

    private boolean matches(T element, Map<String, String> filters) {
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            String key = filter.getKey();
            String value = filter.getValue();
            if (!StringUtils.hasText(key) || !StringUtils.hasText(value)) {
                continue;
            }
            try {
                if (!matches(element, key, value)) {
                    return false;
                }
            } catch (IllegalArgumentException e) {
                // Ignore invalid value conversions
                logger.debug("Ignoring filter {}={}: {}", key, value, e.getMessage());
            }
        }
        return true;
    }

    private boolean matches(T element, String key, String value) {
        Class<?> type = element.getClass();
        if (QueryOptions.SEARCH_KEY.equals(key)) {
            List<String> searchable = EntityFields.getSearchableFields(type);
            if (searchable.isEmpty()) {
                return true;
            }
            for (String name : searchable) {
                if (containsIgnoreCase(EntityFields.read(element, EntityFields.getField(type, name)), value)) {
                    return true;
                }
            }
            return false;
        }

        Field field = EntityFields.getField(type, key);
        if (field != null) {
            return matchesField(EntityFields.read(element, field), field.getType(), value);
        }
        if (key.endsWith("Ids") || key.endsWith("Id")) {
            String relation = key.substring(0, key.length() - (key.endsWith("Ids") ? 3 : 2));
            Field relationField = EntityFields.getField(type, relation);
            if (relationField != null) {
                Set<Long> ids = parseIds(value);
                return ids.isEmpty() || matchesRelation(EntityFields.read(element, relationField), ids);
            }
        }
        return true;
    }

    private boolean matchesField(Object actual, Class<?> fieldType, String value) {
        if (fieldType == String.class) {
            return containsIgnoreCase(actual, value);
        }
        Object expected = EntityFields.convert(value, fieldType);
        if (actual == null) {
            return false;
        }
        if (actual instanceof BigDecimal decimal && expected instanceof BigDecimal other) {
            return decimal.compareTo(other) == 0;
        }
        if (expected instanceof String) {
            return actual.toString().equals(expected);
        }
        return actual.equals(expected);
    }

    private boolean matchesRelation(Object related, Set<Long> ids) {
        if (related == null) {
            return false;
        }
        if (related instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> ids.contains(idOf(item)));
        }
        return ids.contains(idOf(related));
    }

    private Long idOf(Object related) {
        if (related == null) {
            return null;
        }
        Field idField = EntityFields.getField(related.getClass(), "id");
        if (idField == null) {
            return null;
        }
        Object id = EntityFields.read(related, idField);
        return id instanceof Number number ? number.longValue() : null;
    }

    private Set<Long> parseIds(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(Long::valueOf)
                .collect(Collectors.toSet());
    }

    private static boolean containsIgnoreCase(Object actual, String value) {
        return actual != null
                && actual.toString().toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT));
    }

    private void validateSort(Sort sort, Class<?> type) {
        for (Sort.Order order : sort) {
            if (!EntityFields.hasField(type, order.getProperty())) {
                throw new BusinessException(ErrorCode.INVALID_QUERY_OPTION,
                        "Unknown sort property: " + order.getProperty());
            }
        }
    }

    private Comparator<T> comparator(Sort sort) {
        Comparator<T> result = null;
        for (Sort.Order order : sort) {
            Comparator<T> next = orderComparator(order);
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private Comparator<T> orderComparator(Sort.Order order) {
        Comparator<Object> values = (a, b) -> {
            if (order.isIgnoreCase() && a instanceof String && b instanceof String) {
                return String.CASE_INSENSITIVE_ORDER.compare((String) a, (String) b);
            }
            if (a instanceof Comparable && a.getClass().isInstance(b)) {
                return ((Comparable) a).compareTo(b);
            }
            return a.toString().compareTo(b.toString());
        };
        if (order.isDescending()) {
            values = values.reversed();
        }
        values = order.getNullHandling() == Sort.NullHandling.NULLS_FIRST
                ? Comparator.nullsFirst(values)
                : Comparator.nullsLast(values);

        Comparator<Object> byValue = values;
        return (a, b) -> byValue.compare(valueOf(a, order.getProperty()), valueOf(b, order.getProperty()));
    }

    private Object valueOf(T element, String property) {
        Field field = EntityFields.getField(element.getClass(), property);
        return field != null ? EntityFields.read(element, field) : null;
    }
}
