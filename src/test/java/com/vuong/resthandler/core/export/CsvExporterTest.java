package com.vuong.resthandler.core.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vuong.resthandler.config.JacksonConfig;
import com.vuong.resthandler.config.RestHandlerProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvExporter Tests")
class CsvExporterTest {

    private RestHandlerProperties properties;
    private CsvExporter exporter;

    @JsonPropertyOrder({ "code", "label", "since" })
    @Getter
    @AllArgsConstructor
    static class Row {
        private String code;
        private String label;
        private LocalDate since;
    }

    @BeforeEach
    void setUp() {
        properties = new RestHandlerProperties();
        // Zone of the clock must not leak into the file name
        Clock clock = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneId.of("Asia/Ho_Chi_Minh"));
        exporter = new CsvExporter(JacksonConfig.csvMapper(), clock, properties);
    }

    private MockHttpServletRequest requestAccepting(String... accept) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/rows");
        for (String value : accept) {
            request.addHeader(HttpHeaders.ACCEPT, value);
        }
        return request;
    }

    @Test
    @DisplayName("Should detect text/csv among accepted types")
    void shouldDetectCsvRequests() {
        assertThat(exporter.isRequested(requestAccepting("text/csv"))).isTrue();
        assertThat(exporter.isRequested(requestAccepting("application/json, text/csv;q=0.2"))).isTrue();
        assertThat(exporter.isRequested(requestAccepting("application/json", "TEXT/CSV"))).isTrue();
    }

    @Test
    @DisplayName("Should not export for wildcards, zero quality, other or invalid types")
    void shouldIgnoreOtherRequests() {
        assertThat(exporter.isRequested(requestAccepting())).isFalse();
        assertThat(exporter.isRequested(requestAccepting("*/*"))).isFalse();
        assertThat(exporter.isRequested(requestAccepting("text/*"))).isFalse();
        assertThat(exporter.isRequested(requestAccepting("text/csv;q=0"))).isFalse();
        assertThat(exporter.isRequested(requestAccepting("application/json"))).isFalse();
        assertThat(exporter.isRequested(requestAccepting("not a media type"))).isFalse();
    }

    @Test
    @DisplayName("Should name the file after the UTC time")
    void shouldNameFileAfterUtcTime() {
        assertThat(exporter.filename()).isEqualTo("export20260102030405.csv");

        properties.getCsv().setFilenamePrefix("products-");
        assertThat(exporter.filename()).isEqualTo("products-20260102030405.csv");
    }

    @Test
    @DisplayName("Should write a header line and quote values containing the separator")
    void shouldWriteDelimitedRows() {
        // Given
        List<Row> rows = List.of(
                new Row("A1", "plain", LocalDate.of(2024, 5, 1)),
                new Row("B2", "semi;colon", null));

        // When
        String csv = new String(exporter.write(rows, Row.class), StandardCharsets.UTF_8);

        // Then
        assertThat(csv.lines()).containsExactly(
                "code;label;since",
                "A1;plain;2024-05-01",
                "B2;\"semi;colon\";");
    }

    @Test
    @DisplayName("Should use the configured separator")
    void shouldUseConfiguredSeparator() {
        // Given
        properties.getCsv().setSeparator(',');

        // When
        String csv = new String(exporter.write(List.of(new Row("A1", "x", null)), Row.class),
                StandardCharsets.UTF_8);

        // Then
        assertThat(csv.lines().findFirst()).contains("code,label,since");
    }

    @Test
    @DisplayName("Should keep non-ASCII text in UTF-8")
    void shouldEncodeUtf8() {
        // When
        byte[] body = exporter.write(List.of(new Row("VN", "Hà Nội", null)), Row.class);

        // Then
        assertThat(new String(body, StandardCharsets.UTF_8)).contains("Hà Nội");
    }
}
