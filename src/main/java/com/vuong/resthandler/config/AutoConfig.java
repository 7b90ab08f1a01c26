package com.vuong.resthandler.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration imported by {@link com.vuong.resthandler.annotation.EnableRestHandler}.
 * Scans the module's packages and provides the clock used to stamp exports.
 */
@Configuration
@ComponentScan(basePackages = "com.vuong.resthandler")
public class AutoConfig {

    /**
     * Clock used to stamp exported file names. Applications may declare their own.
     * @return the UTC system clock
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock restHandlerClock() {
        return Clock.systemUTC();
    }
}
