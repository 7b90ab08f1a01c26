package com.vuong.resthandler.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.hibernate6.Hibernate6Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson setup for both response formats. JSON pages and error payloads go through
 * the application's ObjectMapper, customized here; CSV exports use their own mapper
 * from {@link #csvMapper()}. Dates are written as ISO strings in both.
 */
@Configuration
public class JacksonConfig {

    /**
     * Lazy associations that were not loaded are written as their id, and null
     * properties are left out so that absent counts and links do not show up.
     * @return the customizer applied to the application's ObjectMapper
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer restHandlerJacksonCustomizer() {
        return builder -> {
            Hibernate6Module hibernateModule = new Hibernate6Module();
            hibernateModule.configure(Hibernate6Module.Feature.SERIALIZE_IDENTIFIER_FOR_LAZY_NOT_LOADED_OBJECTS, true);

            builder.modulesToInstall(new JavaTimeModule(), hibernateModule)
                    .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                            SerializationFeature.FAIL_ON_EMPTY_BEANS,
                            DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .serializationInclusion(JsonInclude.Include.NON_NULL);
        };
    }

    /**
     * Not a bean: a CsvMapper is an ObjectMapper and would compete with the JSON one.
     * @return a new mapper for CSV exports
     */
    public static CsvMapper csvMapper() {
        CsvMapper csvMapper = new CsvMapper();
        csvMapper.registerModule(new JavaTimeModule());
        csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return csvMapper;
    }
}
