package com.recordhub.phoneauth.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI at /swagger-ui.html. Declares the bearer scheme referenced by protected endpoints.
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "Bearer Authentication";

    @Bean
    public OpenAPI phoneAuthOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Phone Auth API")
                .version("0.1.0")
                .description("Sign-in with one-time codes sent by SMS. Verified callers receive a JWT access token."))
            .components(new Components()
                .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .bearerFormat("JWT")));
    }
}
