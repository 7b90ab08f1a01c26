package com.vuong.resthandler.core.service;

import com.vuong.resthandler.core.domain.BaseEntity;

import java.util.List;

/**
 * CRUD operations every entity service provides.
 * @param <T> the entity type
 */
public interface GenericEntityService<T extends BaseEntity> {

    T add(T entity);

    T update(T entity);

    /**
     * @param id the entity id
     * @return the entity
     * @throws com.vuong.resthandler.exception.NotFoundException if no entity has this id
     */
    T get(long id);

    /**
     * @return all entities, empty if there are none
     */
    List<T> getAll();

    void delete(T entity);
}
