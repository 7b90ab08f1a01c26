package com.vuong.resthandler.util;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request identifiers into the MDC for the duration of a request and logs
 * each request with the status it was answered with.
 */
@Component
@Order(0) // Execute before other filters
public class LoggingFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final String REQUEST_ID_KEY = "requestId";
    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String METHOD_KEY = "method";
    private static final String URI_KEY = "uri";
    private static final String ACCEPT_KEY = "accept";

    private final InputSanitizer inputSanitizer;

    public LoggingFilter(InputSanitizer inputSanitizer) {
        this.inputSanitizer = inputSanitizer;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.trim().isEmpty()) {
            requestId = UUID.randomUUID().toString();
        }

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.trim().isEmpty()) {
            correlationId = requestId; // Use request ID as correlation ID if not provided
        }

        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(METHOD_KEY, request.getMethod());
        MDC.put(URI_KEY, request.getRequestURI());
        MDC.put(ACCEPT_KEY, request.getHeader(HttpHeaders.ACCEPT));

        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        long start = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            logger.info("{} {}{} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                    request.getQueryString() != null
                            ? "?" + inputSanitizer.sanitizeForLogging(request.getQueryString())
                            : "",
                    response.getStatus(), System.currentTimeMillis() - start);
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(METHOD_KEY);
            MDC.remove(URI_KEY);
            MDC.remove(ACCEPT_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Skip filtering for actuator and static resources
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator/") ||
               uri.startsWith("/swagger-ui/") ||
               uri.startsWith("/v3/api-docs") ||
               uri.endsWith(".ico") ||
               uri.endsWith(".css") ||
               uri.endsWith(".js");
    }
}
