package com.vuong.resthandler.exception;

import com.vuong.resthandler.dto.ErrorCode;

/**
 * Unexpected failure with a declared internal code, for example a projection
 * or export that could not be produced. Answered with 500.
 */
public class InternalException extends RuntimeException implements ClassifiedException {

    private final ErrorCode errorCode;

    public InternalException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBusiness()) {
            throw new IllegalArgumentException("Not an internal error code: " + errorCode);
        }
        this.errorCode = errorCode;
    }

    @Override
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
