package com.vuong.resthandler.annotation;


import org.springframework.context.annotation.Import;
import com.vuong.resthandler.config.AutoConfig;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables the rest handler module in a Spring Boot application.
 * This imports {@link com.vuong.resthandler.config.AutoConfig}, which registers
 * {@link com.vuong.resthandler.core.outcome.RequestOutcomeHandler}, the query
 * option parser and the CSV exporter.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({AutoConfig.class})
public @interface EnableRestHandler {
}
