package com.vuong.resthandler.dto;

import org.springframework.http.HttpStatus;

/**
 * Error codes carried by classified exceptions and error payloads.
 * Each code declares the family it belongs to; the family alone decides
 * whether a failure is answered as a client fault or a server fault.
 */
public enum ErrorCode {
    // General errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "Internal server error occurred", Family.INTERNAL),
    BAD_REQUEST("BAD_REQUEST", "Bad request", Family.BUSINESS),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed", Family.BUSINESS),
    INVALID_QUERY_OPTION("INVALID_QUERY_OPTION", "Invalid query option", Family.BUSINESS),

    // Business logic errors
    ENTITY_NOT_FOUND("ENTITY_NOT_FOUND", "Entity not found", Family.BUSINESS),
    DUPLICATE_ENTITY("DUPLICATE_ENTITY", "Entity already exists", Family.BUSINESS),
    INVALID_OPERATION("INVALID_OPERATION", "Invalid operation", Family.BUSINESS),
    BUSINESS_RULE_VIOLATION("BUSINESS_RULE_VIOLATION", "Business rule violated", Family.BUSINESS),

    // Data access errors
    DATA_ACCESS_ERROR("DATA_ACCESS_ERROR", "Data access error", Family.INTERNAL),

    // Export and projection errors
    PROJECTION_ERROR("PROJECTION_ERROR", "Projection failed", Family.INTERNAL),
    EXPORT_ERROR("EXPORT_ERROR", "Export failed", Family.INTERNAL);

    /**
     * Failure families. {@code BUSINESS} failures are expected and client-correctable,
     * everything else is {@code INTERNAL}.
     */
    public enum Family {
        BUSINESS(HttpStatus.BAD_REQUEST),
        INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

        private final HttpStatus status;

        Family(HttpStatus status) {
            this.status = status;
        }

        public HttpStatus getStatus() {
            return status;
        }
    }

    private final String code;
    private final String defaultMessage;
    private final Family family;

    ErrorCode(String code, String defaultMessage, Family family) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.family = family;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public Family getFamily() {
        return family;
    }

    public boolean isBusiness() {
        return family == Family.BUSINESS;
    }
}
