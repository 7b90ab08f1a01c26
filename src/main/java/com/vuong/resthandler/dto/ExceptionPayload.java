package com.vuong.resthandler.dto;

import com.vuong.resthandler.core.outcome.FaultDetail;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Error body returned for business and internal faults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExceptionPayload {
    /** Timestamp when the error occurred. */
    private LocalDateTime timestamp;
    /** HTTP status code of the error. */
    private int status;
    /** Error code, see {@link ErrorCode#getCode()}. */
    private String error;
    /** Simple name of the raised exception, absent for faults returned as values. */
    private String type;
    private String message;
    /** Request path that caused the error. */
    private String path;
    /** Field failures, absent unless the fault carried any. */
    private List<ValidationFailure> validationErrors;

    /**
     * Builds the payload for a raised error.
     * @param error the raised error
     * @return the payload
     */
    public static ExceptionPayload from(Throwable error) {
        return from(FaultDetail.from(error));
    }

    /**
     * Builds the payload for a fault detail. The status follows the family of its error code.
     * @param detail the fault
     * @return the payload
     */
    public static ExceptionPayload from(FaultDetail detail) {
        ExceptionPayload payload = new ExceptionPayload();
        payload.setTimestamp(LocalDateTime.now());
        payload.setStatus(detail.getFamily().getStatus().value());
        payload.setError(detail.getErrorCode().getCode());
        payload.setType(detail.getCause() != null ? detail.getCause().getClass().getSimpleName() : null);
        payload.setMessage(detail.getMessage());
        payload.setValidationErrors(detail.hasValidationFailures() ? detail.getValidationFailures() : null);
        return payload;
    }
}
