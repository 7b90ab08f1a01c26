package com.vuong.resthandler.dto;

import jakarta.validation.ConstraintViolation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.validation.FieldError;

/**
 * A single field-level validation problem.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationFailure {
    /** Name of the field that failed validation. */
    private String field;
    /** Validation error message for the field. */
    private String message;
    /** The rejected value, if any. */
    private Object rejectedValue;

    public ValidationFailure(String field, String message) {
        this(field, message, null);
    }

    /**
     * Builds a failure from a Bean Validation constraint violation.
     * @param violation the violation reported by the validator
     * @return the matching validation failure
     */
    public static ValidationFailure from(ConstraintViolation<?> violation) {
        return new ValidationFailure(
                violation.getPropertyPath().toString(),
                violation.getMessage(),
                violation.getInvalidValue());
    }

    /**
     * Builds a failure from a Spring binding field error.
     * @param error the binding error
     * @return the matching validation failure
     */
    public static ValidationFailure from(FieldError error) {
        return new ValidationFailure(error.getField(), error.getDefaultMessage(), error.getRejectedValue());
    }
}
