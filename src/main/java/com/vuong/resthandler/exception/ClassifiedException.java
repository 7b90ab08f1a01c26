package com.vuong.resthandler.exception;

import com.vuong.resthandler.dto.ErrorCode;

/**
 * Implemented by exceptions that declare their own {@link ErrorCode}.
 * Exceptions that do not implement it are always treated as internal faults.
 */
public interface ClassifiedException {

    ErrorCode getErrorCode();
}
