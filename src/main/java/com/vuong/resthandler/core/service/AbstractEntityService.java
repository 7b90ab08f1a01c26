package com.vuong.resthandler.core.service;

import com.vuong.resthandler.core.domain.BaseEntity;
import com.vuong.resthandler.core.domain.repository.GenericRepository;
import com.vuong.resthandler.core.query.QuerySource;
import com.vuong.resthandler.core.query.SpecificationQuerySource;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.dto.ValidationFailure;
import com.vuong.resthandler.exception.BusinessException;
import com.vuong.resthandler.exception.NotFoundException;
import com.vuong.resthandler.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * {@link GenericEntityService} over a {@link GenericRepository}.
 * Entities are checked with Bean Validation before they are saved;
 * a missing id is reported as {@link NotFoundException}.
 * @param <T> the entity type
 */
@Transactional
public abstract class AbstractEntityService<T extends BaseEntity> implements GenericEntityService<T> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractEntityService.class);

    private final GenericRepository<T> repository;
    private final Class<T> entityClass;
    private final Validator validator;

    protected AbstractEntityService(GenericRepository<T> repository, Class<T> entityClass, Validator validator) {
        this.repository = repository;
        this.entityClass = entityClass;
        this.validator = validator;
    }

    @Override
    public T add(T entity) {
        if (entity == null) {
            throw new BusinessException(ErrorCode.INVALID_OPERATION, "Entity cannot be null");
        }
        if (!entity.isNew()) {
            throw new BusinessException(ErrorCode.INVALID_OPERATION,
                    "New " + entityClass.getSimpleName() + " cannot have an id");
        }
        validate(entity);

        T saved = repository.save(entity);
        logger.info("Successfully created entity of type: {} with ID: {}", entityClass.getSimpleName(), saved.getId());
        return saved;
    }

    @Override
    public T update(T entity) {
        if (entity == null || entity.isNew()) {
            throw new BusinessException(ErrorCode.INVALID_OPERATION,
                    "Updated " + entityClass.getSimpleName() + " must have an id");
        }
        if (!repository.existsById(entity.getId())) {
            throw NotFoundException.of(entityClass, entity.getId());
        }
        validate(entity);

        T saved = repository.save(entity);
        logger.info("Successfully updated entity of type: {} with ID: {}", entityClass.getSimpleName(), saved.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public T get(long id) {
        return repository.findById(id)
                .orElseThrow(() -> NotFoundException.of(entityClass, id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<T> getAll() {
        return repository.findAll();
    }

    @Override
    public void delete(T entity) {
        if (entity == null || entity.isNew() || !repository.existsById(entity.getId())) {
            throw NotFoundException.of(entityClass, entity != null ? entity.getId() : null);
        }
        logger.debug("Deleting entity of type: {} with ID: {}", entityClass.getSimpleName(), entity.getId());
        repository.deleteById(entity.getId());
        logger.info("Successfully deleted entity of type: {} with ID: {}", entityClass.getSimpleName(), entity.getId());
    }

    /**
     * @return a query source that filters, sorts and pages in the database
     */
    public QuerySource<T> query() {
        return new SpecificationQuerySource<>(repository, entityClass);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    protected GenericRepository<T> getRepository() {
        return repository;
    }

    /**
     * @param entity the entity to check
     * @throws ValidationException listing every violated constraint, ordered by field
     */
    protected void validate(T entity) {
        Set<ConstraintViolation<T>> violations = validator.validate(entity);
        if (!violations.isEmpty()) {
            List<ValidationFailure> failures = violations.stream()
                    .map(ValidationFailure::from)
                    .sorted(Comparator.comparing(ValidationFailure::getField))
                    .toList();
            throw new ValidationException(failures);
        }
    }
}
