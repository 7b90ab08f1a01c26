package com.vuong.resthandler.core.outcome;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.dto.ValidationFailure;
import com.vuong.resthandler.exception.ClassifiedException;
import com.vuong.resthandler.exception.ValidationException;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Describes why an operation failed: the declared error code, a message,
 * optional field failures and the underlying cause when there is one.
 */
@Getter
@ToString(exclude = "cause")
public final class FaultDetail {

    private final ErrorCode errorCode;
    private final String message;
    private final List<ValidationFailure> validationFailures;
    @JsonIgnore
    private final Throwable cause;

    private FaultDetail(ErrorCode errorCode, String message, List<ValidationFailure> validationFailures,
                        Throwable cause) {
        this.errorCode = errorCode;
        this.message = message != null ? message : errorCode.getDefaultMessage();
        this.validationFailures = validationFailures != null ? List.copyOf(validationFailures) : List.of();
        this.cause = cause;
    }

    public static FaultDetail of(ErrorCode errorCode, String message) {
        return new FaultDetail(errorCode, message, null, null);
    }

    public static FaultDetail of(ErrorCode errorCode, String message, List<ValidationFailure> failures) {
        return new FaultDetail(errorCode, message, failures, null);
    }

    /**
     * Builds the detail for a raised error. The code comes from
     * {@link ClassifiedException#getErrorCode()}; any other error is
     * {@link ErrorCode#INTERNAL_SERVER_ERROR}.
     * @param error the raised error
     * @return the fault detail
     */
    public static FaultDetail from(Throwable error) {
        ErrorCode code = null;
        if (error instanceof ClassifiedException classified) {
            code = classified.getErrorCode();
        }
        if (code == null) {
            code = ErrorCode.INTERNAL_SERVER_ERROR;
        }
        List<ValidationFailure> failures = error instanceof ValidationException validation
                ? validation.getFailures()
                : null;
        return new FaultDetail(code, error.getMessage(), failures, error);
    }

    public ErrorCode.Family getFamily() {
        return errorCode.getFamily();
    }

    public boolean hasValidationFailures() {
        return !validationFailures.isEmpty();
    }
}
