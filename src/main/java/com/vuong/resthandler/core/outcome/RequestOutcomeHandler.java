package com.vuong.resthandler.core.outcome;

import com.vuong.resthandler.core.export.CsvExporter;
import com.vuong.resthandler.core.projection.Projection;
import com.vuong.resthandler.core.query.NextLinkBuilder;
import com.vuong.resthandler.core.query.QueryOptions;
import com.vuong.resthandler.core.query.QueryResult;
import com.vuong.resthandler.core.query.QuerySource;
import com.vuong.resthandler.dto.ExceptionPayload;
import com.vuong.resthandler.dto.ValidationFailure;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns the outcome of endpoint work into HTTP responses.
 * <p>
 * Controllers inject this component and return what it builds:
 * <ul>
 *     <li>{@link #handleCallback(Supplier)} runs work and answers 200 with its value,
 *     or the classified failure;</li>
 *     <li>{@link #handleOutcome(Outcome)} does the same for work that returns an {@link Outcome};</li>
 *     <li>{@link #handleQuery(QuerySource, QueryOptions, Projection)} answers list endpoints
 *     with a JSON page or a CSV attachment depending on the {@code Accept} header;</li>
 *     <li>{@link #handleValidationFailure(List)} answers 400 with the failures as they are.</li>
 * </ul>
 * No failure escapes these methods. Business faults are answered with 400 and every
 * other failure with 500, both with an {@link ExceptionPayload} body. Failure bodies are
 * always JSON, also for requests that asked for CSV.
 */
@Component
public class RequestOutcomeHandler {

    private static final Logger logger = LoggerFactory.getLogger(RequestOutcomeHandler.class);

    private final HttpServletRequest request;
    private final CsvExporter csvExporter;
    private final NextLinkBuilder nextLinkBuilder;

    /**
     * @param request the current request, a proxy to the request bound to the calling thread
     * @param csvExporter the CSV writer
     * @param nextLinkBuilder the next page link builder
     */
    public RequestOutcomeHandler(HttpServletRequest request, CsvExporter csvExporter,
                                 NextLinkBuilder nextLinkBuilder) {
        this.request = request;
        this.csvExporter = csvExporter;
        this.nextLinkBuilder = nextLinkBuilder;
    }

    /**
     * Runs the work and answers with its value.
     * @param work the endpoint work
     * @param <S> the value type
     * @return 200 with the value, or the response of {@link #handleFailure(Throwable)}
     */
    public <S> ResponseEntity<?> handleCallback(Supplier<S> work) {
        return handleOutcome(Outcome.of(work));
    }

    /**
     * Answers with the value of an OK outcome, or the payload of a fault.
     * @param outcome the outcome of the endpoint work
     * @param <S> the value type
     * @return 200, 400 or 500 depending on the outcome kind
     */
    public <S> ResponseEntity<?> handleOutcome(Outcome<S> outcome) {
        switch (outcome.getKind()) {
            case OK:
                return ResponseEntity.ok(outcome.getValue());
            case BUSINESS_FAULT:
            case INTERNAL_FAULT:
                return faultResponse(outcome.getFault());
            default:
                throw new IllegalStateException("Unknown outcome kind: " + outcome.getKind());
        }
    }

    /**
     * Answers a list request. When the {@code Accept} header asks for {@code text/csv}
     * the projected rows are sent as an attachment, otherwise as a {@link PageResult}.
     * @param source the elements to query
     * @param options filter, sort, paging and count directives
     * @param projection the conversion applied to each returned element
     * @param <O> the source element type
     * @param <R> the returned element type
     * @return the page, the file, or the failure response
     */
    public <O, R> ResponseEntity<?> handleQuery(QuerySource<O> source, QueryOptions options,
                                                Projection<O, R> projection) {
        Outcome<ResponseEntity<?>> outcome = Outcome.of(() -> negotiate(source, options, projection));
        return outcome.fold(response -> response, this::faultResponse);
    }

    public <O, R> ResponseEntity<?> handleQuery(Collection<? extends O> source, QueryOptions options,
                                                Projection<O, R> projection) {
        return handleQuery(QuerySource.<O>of(source), options, projection);
    }

    /**
     * Applies the options, then projects the materialized page.
     * @param source the elements to query
     * @param options filter, sort, paging and count directives
     * @param projection the conversion applied to each returned element
     * @param <O> the source element type
     * @param <R> the returned element type
     * @return the page with the next page link, and the filtered total when counting was asked for
     */
    public <O, R> PageResult<R> handlePageResult(QuerySource<O> source, QueryOptions options,
                                                 Projection<O, R> projection) {
        QueryResult<O> result = source.fetch(options);
        List<R> items = projection.applyAll(result.getItems());
        String nextLink = nextLinkBuilder.build(request, options, result);
        Long count = options.isCount() ? result.getTotalCount() : null;

        logger.debug("Returning {} of {} {} item(s)", items.size(), result.getTotalCount(),
                projection.getType().getSimpleName());
        return new PageResult<>(items, nextLink, count);
    }

    /**
     * Classifies the error by its declared error code.
     * @param error the raised error
     * @return 400 for business faults, 500 for everything else, with the error payload
     */
    public ResponseEntity<ExceptionPayload> handleFailure(Throwable error) {
        return faultResponse(Outcome.failure(error).getFault());
    }

    /**
     * @param failures the validation failures
     * @param <F> the failure type
     * @return 400 with the same list as body
     */
    public <F extends ValidationFailure> ResponseEntity<List<F>> handleValidationFailure(List<F> failures) {
        logger.warn("Validation failed for {}: {} error(s)", request.getRequestURI(), failures.size());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(failures);
    }

    private <O, R> ResponseEntity<?> negotiate(QuerySource<O> source, QueryOptions options,
                                               Projection<O, R> projection) {
        if (csvExporter.isRequested(request)) {
            return handleCsvFile(source, options, projection);
        }
        return ResponseEntity.ok(handlePageResult(source, options, projection));
    }

    // Paged only when the caller asked for a page; otherwise the whole filtered set is exported.
    private <O, R> ResponseEntity<byte[]> handleCsvFile(QuerySource<O> source, QueryOptions options,
                                                       Projection<O, R> projection) {
        QueryOptions exportOptions = options.isExplicitPaging() ? options : options.withoutPaging();
        List<R> rows = projection.applyAll(source.fetch(exportOptions).getItems());
        return csvExporter.export(rows, projection.getType());
    }

    private ResponseEntity<ExceptionPayload> faultResponse(FaultDetail fault) {
        ExceptionPayload payload = ExceptionPayload.from(fault);
        payload.setPath(request.getRequestURI());

        if (fault.getErrorCode().isBusiness()) {
            logger.warn("Business fault {} on {}: {}", fault.getErrorCode().getCode(), payload.getPath(),
                    fault.getMessage());
        } else {
            logger.error("Internal fault {} on {}: {}", fault.getErrorCode().getCode(), payload.getPath(),
                    fault.getMessage(), fault.getCause());
        }
        // JSON whatever the Accept header asked for
        return ResponseEntity.status(payload.getStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload);
    }
}
