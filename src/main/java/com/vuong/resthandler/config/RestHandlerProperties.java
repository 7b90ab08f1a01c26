package com.vuong.resthandler.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the rest handler module.
 */
@Component
@ConfigurationProperties(prefix = "app.rest-handler")
@Getter
@Setter
public class RestHandlerProperties {

    private Csv csv = new Csv();

    private Paging paging = new Paging();

    @Getter
    @Setter
    public static class Csv {
        /**
         * Column separator of exported files.
         */
        private char separator = ';';

        /**
         * Exported file names are this prefix followed by the UTC timestamp.
         */
        private String filenamePrefix = "export";
    }

    @Getter
    @Setter
    public static class Paging {
        /**
         * Page size used when a request names none.
         */
        private int defaultSize = 20;

        /**
         * Requested page sizes above this are clamped.
         */
        private int maxSize = 200;

        /**
         * Report the filtered total when a request does not say.
         */
        private boolean countByDefault = false;
    }
}
