package com.vuong.resthandler.exception;

import com.vuong.resthandler.dto.ErrorCode;

/**
 * Thrown when an entity with the requested id does not exist.
 */
public class NotFoundException extends BusinessException {

    public NotFoundException(String message) {
        super(ErrorCode.ENTITY_NOT_FOUND, message);
    }

    public static NotFoundException of(Class<?> entityClass, Object id) {
        return new NotFoundException("Not found " + entityClass.getSimpleName() + " with id: " + id);
    }
}
