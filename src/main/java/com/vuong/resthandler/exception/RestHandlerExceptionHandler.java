package com.vuong.resthandler.exception;

import com.vuong.resthandler.core.outcome.RequestOutcomeHandler;
import com.vuong.resthandler.dto.ExceptionPayload;
import com.vuong.resthandler.dto.ValidationFailure;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Answers exceptions that escape controllers the same way
 * {@link RequestOutcomeHandler} answers failures of handled work.
 */
@RestControllerAdvice
@Component
@ConditionalOnMissingBean(RestHandlerExceptionHandler.class)
public class RestHandlerExceptionHandler {

    private final RequestOutcomeHandler outcomeHandler;

    public RestHandlerExceptionHandler(RequestOutcomeHandler outcomeHandler) {
        this.outcomeHandler = outcomeHandler;
    }

    /**
     * Handles request body validation failures with a 400 listing the field errors.
     * @param ex the exception thrown by argument validation
     * @return ResponseEntity with the failures and 400 status
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<List<ValidationFailure>> handleArgumentNotValid(MethodArgumentNotValidException ex) {
        List<ValidationFailure> failures = ex.getBindingResult().getFieldErrors().stream()
                .map(ValidationFailure::from)
                .toList();
        return outcomeHandler.handleValidationFailure(failures);
    }

    /**
     * Handles every other exception: 400 for business faults, 500 otherwise.
     * @param ex the exception
     * @return ResponseEntity with the error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ExceptionPayload> handleException(Exception ex) {
        return outcomeHandler.handleFailure(ex);
    }
}
