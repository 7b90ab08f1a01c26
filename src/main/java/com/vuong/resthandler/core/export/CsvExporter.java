package com.vuong.resthandler.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.vuong.resthandler.config.JacksonConfig;
import com.vuong.resthandler.config.RestHandlerProperties;
import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.exception.InternalException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;

/**
 * Writes projected rows as a delimited text attachment.
 * <p>
 * The body is sent as {@code application/octet-stream} so that browsers download
 * it instead of rendering it.
 */
@Component
public class CsvExporter {

    private static final Logger logger = LoggerFactory.getLogger(CsvExporter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final CsvMapper csvMapper;
    private final Clock clock;
    private final RestHandlerProperties properties;

    @Autowired
    public CsvExporter(Clock clock, RestHandlerProperties properties) {
        this(JacksonConfig.csvMapper(), clock, properties);
    }

    public CsvExporter(CsvMapper csvMapper, Clock clock, RestHandlerProperties properties) {
        this.csvMapper = csvMapper;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Tells whether the request's {@code Accept} header lists {@code text/csv}.
     * Wildcards do not count, nor does a zero quality.
     * @param request the current request
     * @return true if a CSV export was asked for
     */
    public boolean isRequested(HttpServletRequest request) {
        for (String header : Collections.list(request.getHeaders(HttpHeaders.ACCEPT))) {
            List<MediaType> accepted;
            try {
                accepted = MediaType.parseMediaTypes(header);
            } catch (InvalidMediaTypeException e) {
                logger.debug("Ignoring invalid Accept header '{}': {}", header, e.getMessage());
                continue;
            }
            for (MediaType mediaType : accepted) {
                if (MediaTypes.TEXT_CSV.equalsTypeAndSubtype(mediaType) && mediaType.getQualityValue() > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Builds the attachment response for the rows.
     * @param rows the projected rows, may be empty
     * @param type the row type, defines the columns
     * @param <R> the row type
     * @return a 200 response with the file as body
     */
    public <R> ResponseEntity<byte[]> export(List<R> rows, Class<R> type) {
        byte[] body = write(rows, type);
        String filename = filename();
        logger.info("Exporting {} {} row(s) as {}", rows.size(), type.getSimpleName(), filename);

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(filename)
                        .build()
                        .toString())
                .contentLength(body.length)
                .body(body);
    }

    /**
     * Serializes the rows with a header line, UTF-8 encoded.
     * @param rows the rows
     * @param type the row type
     * @param <R> the row type
     * @return the document bytes
     */
    public <R> byte[] write(List<R> rows, Class<R> type) {
        CsvSchema schema = csvMapper.schemaFor(type)
                .withHeader()
                .withColumnSeparator(properties.getCsv().getSeparator());
        try {
            return csvMapper.writer(schema).writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new InternalException(ErrorCode.EXPORT_ERROR,
                    "Failed to write " + type.getSimpleName() + " rows as CSV: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return the attachment name, the configured prefix followed by the current UTC time
     */
    public String filename() {
        return properties.getCsv().getFilenamePrefix() + FILE_TIMESTAMP.format(clock.instant()) + ".csv";
    }
}
