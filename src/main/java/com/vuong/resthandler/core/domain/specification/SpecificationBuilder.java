package com.vuong.resthandler.core.domain.specification;

import com.vuong.resthandler.core.query.EntityFields;
import com.vuong.resthandler.core.query.QueryOptions;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds JPA Specifications from query option filters.
 * Supports global search across String fields, relationship filtering with
 * {@code <relation>Id} / {@code <relation>Ids} keys and direct field filtering
 * for strings, booleans, numbers and enums.
 * String values match as literal case-insensitive substrings, {@code %} and {@code _}
 * included. Joining a collection makes the query distinct.
 */
public final class SpecificationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SpecificationBuilder.class);

    private static final char LIKE_ESCAPE = '\\';

    private SpecificationBuilder() {
    }

    /**
     * Builds a Specification from a map of filters for the given entity class.
     *
     * @param filters     field names to filter values (e.g. "status" -> "ACTIVE", "search" -> "query")
     * @param entityClass the JPA entity class
     * @param <T>         the entity type
     * @return a Specification usable with JpaSpecificationExecutor
     */
    public static <T> Specification<T> build(Map<String, String> filters, Class<T> entityClass) {
        return (root, query, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();

            filters.forEach((key, value) -> {
                if (!StringUtils.hasText(key) || !StringUtils.hasText(value))
                    return;

                if (QueryOptions.SEARCH_KEY.equals(key)) {
                    handleGlobalSearch(value, entityClass, root, criteriaBuilder, predicates);
                } else if (EntityFields.hasField(entityClass, key)) {
                    handleFieldFilter(key, value, entityClass, root, criteriaBuilder, predicates);
                } else if (key.endsWith("Ids") || key.endsWith("Id")) {
                    handleRelationshipFilter(key, value, entityClass, root, query, predicates);
                }
            });

            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static <T> void handleGlobalSearch(String searchValue, Class<T> entityClass, Root<T> root,
            CriteriaBuilder cb, List<Predicate> predicates) {
        List<String> searchableFields = EntityFields.getSearchableFields(entityClass);
        List<Predicate> orPredicates = new ArrayList<>();
        for (String field : searchableFields) {
            orPredicates.add(containsIgnoreCase(cb, root.get(field), searchValue));
        }
        if (!orPredicates.isEmpty())
            predicates.add(cb.or(orPredicates.toArray(new Predicate[0])));
    }

    private static <T> void handleRelationshipFilter(String key, String value, Class<T> entityClass, Root<T> root,
            CriteriaQuery<?> query, List<Predicate> predicates) {
        String relationName = key.substring(0, key.length() - (key.endsWith("Ids") ? 3 : 2));
        Field relationField = EntityFields.getField(entityClass, relationName);
        if (relationField == null) {
            return;
        }

        List<Long> ids;
        try {
            ids = parseIds(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring relationship filter {}={}: {}", key, value, e.getMessage());
            return;
        }
        if (ids.isEmpty()) {
            return;
        }

        Join<Object, Object> join = root.join(relationName, JoinType.LEFT);
        if (Collection.class.isAssignableFrom(relationField.getType())) {
            // One row per matching element otherwise
            query.distinct(true);
        }
        predicates.add(join.get("id").in(ids));
    }

    private static List<Long> parseIds(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(Long::valueOf)
                .toList();
    }

    private static <T> void handleFieldFilter(String key, String value, Class<T> entityClass, Root<T> root,
            CriteriaBuilder cb, List<Predicate> predicates) {
        Field field = EntityFields.getField(entityClass, key);
        Class<?> fieldType = field.getType();

        try {
            if (fieldType == String.class) {
                predicates.add(containsIgnoreCase(cb, root.get(key), value));
            } else {
                predicates.add(cb.equal(root.get(key), EntityFields.convert(value, fieldType)));
            }
        } catch (IllegalArgumentException e) {
            // Ignore invalid value conversions
            logger.debug("Ignoring filter {}={}: {}", key, value, e.getMessage());
        }
    }

    private static Predicate containsIgnoreCase(CriteriaBuilder cb, Path<String> path,
            String value) {
        String pattern = "%" + escapeLike(value.toLowerCase(Locale.ROOT)) + "%";
        return cb.like(cb.lower(path), pattern, LIKE_ESCAPE);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
