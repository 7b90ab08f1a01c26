package com.vuong.resthandler.core.query;

import com.vuong.resthandler.core.domain.specification.SpecificationBuilder;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.exception.BusinessException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.mapping.PropertyReferenceException;

import java.util.List;
import java.util.Objects;

/**
 * Query source backed by a JPA repository. Filters become a {@link Specification},
 * sorting and paging a {@link org.springframework.data.domain.Pageable}, so the
 * database does the work and only the requested page is loaded.
 * @param <T> the entity type
 */
public class SpecificationQuerySource<T> implements QuerySource<T> {

    private final JpaSpecificationExecutor<T> repository;
    private final Class<T> entityClass;

    public SpecificationQuerySource(JpaSpecificationExecutor<T> repository, Class<T> entityClass) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
    }

    @Override
    public QueryResult<T> fetch(QueryOptions options) {
        Specification<T> spec = SpecificationBuilder.build(options.getFilters(), entityClass);
        try {
            if (!options.isPaged()) {
                List<T> items = repository.findAll(spec, options.getSort());
                return new QueryResult<>(items, items.size(), false);
            }
            Page<T> page = repository.findAll(spec, options.toPageable());
            return new QueryResult<>(page.getContent(), page.getTotalElements(), page.hasNext());
        } catch (PropertyReferenceException e) {
            throw unknownProperty(e);
        } catch (InvalidDataAccessApiUsageException e) {
            if (e.getCause() instanceof PropertyReferenceException reference) {
                throw unknownProperty(reference);
            }
            throw e;
        }
    }

    private static BusinessException unknownProperty(PropertyReferenceException e) {
        return new BusinessException(ErrorCode.INVALID_QUERY_OPTION, "Unknown sort property: "
                + e.getPropertyName(), e);
    }
}
