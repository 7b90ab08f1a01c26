package com.vuong.resthandler.exception;

import com.vuong.resthandler.dto.ErrorCode;

/**
 * Expected, client-correctable failure such as a violated domain rule.
 * Answered with 400 Bad Request.
 */
public class BusinessException extends RuntimeException implements ClassifiedException {

    private final ErrorCode errorCode;

    public BusinessException(String message) {
        this(ErrorCode.BUSINESS_RULE_VIOLATION, message);
    }

    /**
     * @param errorCode a code of the {@link ErrorCode.Family#BUSINESS} family
     * @param message   the error message
     * @throws IllegalArgumentException if the code is not a business code
     */
    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : requireBusiness(errorCode).getDefaultMessage(), cause);
        this.errorCode = requireBusiness(errorCode);
    }

    @Override
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    private static ErrorCode requireBusiness(ErrorCode errorCode) {
        if (errorCode == null || !errorCode.isBusiness()) {
            throw new IllegalArgumentException("Not a business error code: " + errorCode);
        }
        return errorCode;
    }
}
