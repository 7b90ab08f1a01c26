package com.vuong.resthandler.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description of the API, with the shared error schemas.
 */
@Configuration
public class OpenApiConfig {

    @Value("${app.openapi.title:Rest Handler API}")
    private String title;

    @Value("${app.openapi.description:REST API with CSV export and classified errors}")
    private String description;

    @Value("${app.openapi.version:1.0.0}")
    private String version;

    @Value("${app.openapi.contact.name:Rest Handler Team}")
    private String contactName;

    @Value("${app.openapi.contact.email:}")
    private String contactEmail;

    @Value("${app.openapi.license.name:MIT}")
    private String licenseName;

    @Value("${app.openapi.license.url:}")
    private String licenseUrl;

    @Bean
    @ConditionalOnMissingBean(OpenAPI.class)  // Prevents duplicate OpenAPI beans
    public OpenAPI customOpenAPI() {
        Schema<?> validationFailure = new Schema<>()
                .type("object")
                .addProperty("field", new StringSchema())
                .addProperty("message", new StringSchema())
                .addProperty("rejectedValue", new Schema<>());

        Schema<?> exceptionPayload = new Schema<>()
                .type("object")
                .addProperty("timestamp", new StringSchema().format("date-time"))
                .addProperty("status", new Schema<>().type("integer"))
                .addProperty("error", new StringSchema())
                .addProperty("type", new StringSchema())
                .addProperty("message", new StringSchema())
                .addProperty("path", new StringSchema())
                .addProperty("validationErrors", new ArraySchema().items(
                        new Schema<>().$ref("#/components/schemas/ValidationFailure")));

        return new OpenAPI()
            .info(new Info()
                .title(title)
                .description(description)
                .version(version)
                .contact(new Contact()
                    .name(contactName)
                    .email(contactEmail))
                .license(new License()
                    .name(licenseName)
                    .url(licenseUrl)))
            .components(new Components()
                .addSchemas("ValidationFailure", validationFailure)
                .addSchemas("ExceptionPayload", exceptionPayload));
    }
}
