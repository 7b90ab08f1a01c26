package com.vuong.resthandler.core.query;

import com.vuong.resthandler.config.RestHandlerProperties;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.dto.ValidationFailure;
import com.vuong.resthandler.exception.ValidationException;
import com.vuong.resthandler.util.InputSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryOptionsParser Tests")
class QueryOptionsParserTest {

    private RestHandlerProperties properties;
    private QueryOptionsParser parser;

    @BeforeEach
    void setUp() {
        properties = new RestHandlerProperties();
        parser = new QueryOptionsParser(properties, new InputSanitizer());
    }

    @Test
    @DisplayName("Should use configured defaults when no parameter is given")
    void shouldUseDefaults() {
        // When
        QueryOptions options = parser.parse(Map.of());

        // Then
        assertThat(options.getPage()).isZero();
        assertThat(options.getSize()).isEqualTo(20);
        assertThat(options.isCount()).isFalse();
        assertThat(options.isExplicitPaging()).isFalse();
        assertThat(options.getSort().isUnsorted()).isTrue();
        assertThat(options.hasFilters()).isFalse();
    }

    @Test
    @DisplayName("Should parse paging, sorting and count")
    void shouldParseDirectives() {
        // Given
        Map<String, String> params = Map.of(
                "page", "2",
                "size", "5",
                "sort", "name;price,desc",
                "count", "TRUE");

        // When
        QueryOptions options = parser.parse(params);

        // Then
        assertThat(options.getPage()).isEqualTo(2);
        assertThat(options.getSize()).isEqualTo(5);
        assertThat(options.isCount()).isTrue();
        assertThat(options.isExplicitPaging()).isTrue();
        assertThat(options.getSort()).containsExactly(Sort.Order.asc("name"), Sort.Order.desc("price"));

        Pageable pageable = options.toPageable();
        assertThat(pageable.getPageNumber()).isEqualTo(2);
        assertThat(pageable.getOffset()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should clamp the page size to the configured maximum")
    void shouldClampSize() {
        // Given
        properties.getPaging().setMaxSize(50);

        // When
        QueryOptions options = parser.parse(Map.of("size", "500"));

        // Then
        assertThat(options.getSize()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should count by default when configured to")
    void shouldCountByDefaultWhenConfigured() {
        // Given
        properties.getPaging().setCountByDefault(true);

        // When & Then
        assertThat(parser.parse(Map.of()).isCount()).isTrue();
        assertThat(parser.parse(Map.of("count", "false")).isCount()).isFalse();
    }

    @Test
    @DisplayName("Should keep other parameters as sanitized filters")
    void shouldSanitizeFilters() {
        // Given
        Map<String, String> params = new HashMap<>();
        params.put("name", "  widget\u0001 ");
        params.put("category", "");
        params.put("page", "0");

        // When
        QueryOptions options = parser.parse(params);

        // Then
        assertThat(options.getFilters()).containsExactly(Map.entry("name", "widget"));
        assertThat(params).containsEntry("name", "  widget\u0001 ");
    }

    @Test
    @DisplayName("Should report every invalid directive")
    void shouldReportInvalidDirectives() {
        // Given
        Map<String, String> params = Map.of(
                "page", "-1",
                "size", "abc",
                "sort", "name,sideways",
                "count", "maybe");

        // When
        List<ValidationFailure> failures = parser.validate(params);

        // Then
        assertThat(failures)
                .extracting(ValidationFailure::getField)
                .containsExactly("page", "size", "sort", "count");
        assertThat(failures.get(0).getMessage()).isEqualTo("Page number cannot be negative");
        assertThat(failures.get(1).getRejectedValue()).isEqualTo("abc");
    }

    @Test
    @DisplayName("Should reject a zero page size")
    void shouldRejectZeroSize() {
        assertThat(parser.validate(Map.of("size", "0")))
                .singleElement()
                .extracting(ValidationFailure::getMessage)
                .isEqualTo("Page size must be positive");
    }

    @Test
    @DisplayName("Should accept valid and absent parameters")
    void shouldAcceptValidParameters() {
        assertThat(parser.validate(null)).isEmpty();
        assertThat(parser.validate(Map.of("sort", "", "name", "x"))).isEmpty();
        assertThat(parser.validate(Map.of("page", "1", "size", "10", "sort", "id,asc", "count", "false"))).isEmpty();
    }

    @Test
    @DisplayName("Should throw a business fault when parsing invalid directives")
    void shouldThrowOnInvalidDirectives() {
        assertThatThrownBy(() -> parser.parse(Map.of("page", "first")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    ValidationException validation = (ValidationException) e;
                    assertThat(validation.getErrorCode()).isEqualTo(ErrorCode.INVALID_QUERY_OPTION);
                    assertThat(validation.getFailures()).extracting(ValidationFailure::getField).containsExactly("page");
                });
    }

    @Test
    @DisplayName("Should move to the next page and drop paging on request")
    void shouldDeriveOptions() {
        // Given
        QueryOptions options = QueryOptions.of(1, 10);

        // When
        QueryOptions next = options.next();
        QueryOptions all = options.withoutPaging();

        // Then
        assertThat(next.getPage()).isEqualTo(2);
        assertThat(next.getOffset()).isEqualTo(20);
        assertThat(all.isPaged()).isFalse();
        assertThat(all.toPageable().isUnpaged()).isTrue();
        assertThatThrownBy(all::next).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> QueryOptions.of(-1, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
