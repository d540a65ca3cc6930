package com.socialpost.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String DEFAULT_USERNAME = "alice";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Social Post API")
                        .version("1.0")
                        .description("Posts, likes and comments backed by an event store"));
    }

    @Bean
    public OperationCustomizer addDefaultUsernameHeader() {
        return (operation, handlerMethod) -> {
            if (operation.getParameters() != null) {
                operation.getParameters().stream()
                        .filter(p -> "X-Username".equals(p.getName()))
                        .forEach(p -> {
                            StringSchema schema = new StringSchema();
                            schema.setDefault(DEFAULT_USERNAME);
                            schema.setExample(DEFAULT_USERNAME);
                            p.setSchema(schema);
                            p.setExample(DEFAULT_USERNAME);
                        });
            }
            return operation;
        };
    }
}
