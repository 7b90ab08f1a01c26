package com.vuong.resthandler.exception;

import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.dto.ValidationFailure;

import java.util.List;

/**
 * Business fault raised when an entity or request fails validation.
 * Carries the individual field failures.
 */
public class ValidationException extends BusinessException {

    private final List<ValidationFailure> failures;

    public ValidationException(List<ValidationFailure> failures) {
        this(ErrorCode.VALIDATION_ERROR, failures);
    }

    public ValidationException(ErrorCode errorCode, List<ValidationFailure> failures) {
        super(errorCode, errorCode.getDefaultMessage() + ": " + failures.size() + " error(s)");
        this.failures = List.copyOf(failures);
    }

    public List<ValidationFailure> getFailures() {
        return failures;
    }
}
