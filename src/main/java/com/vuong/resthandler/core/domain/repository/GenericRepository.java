package com.vuong.resthandler.core.domain.repository;

import com.vuong.resthandler.core.domain.BaseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

/**
 * Base repository interface for entities served through
 * {@link com.vuong.resthandler.core.service.AbstractEntityService}.
 * @param <T> the entity type
 */
@NoRepositoryBean
public interface GenericRepository<T extends BaseEntity> extends JpaRepository<T, Long>, JpaSpecificationExecutor<T> {
}
