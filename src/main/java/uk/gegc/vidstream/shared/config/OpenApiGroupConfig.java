package uk.gegc.vidstream.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the bearer security scheme shown in Swagger UI.
 */
@Configuration
public class OpenApiGroupConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI vidStreamOpenApi() {
        return new OpenAPI()
                .info(new Info().title("VidStream API").version("v1"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }

    @Bean
    public GroupedOpenApi authGroup() {
        return GroupedOpenApi.builder()
                .group("auth")
                .displayName("Authentication & Users")
                .pathsToMatch("/api/v1/auth/**", "/api/v1/users/**")
                .build();
    }

    @Bean
    public GroupedOpenApi subscriptionsGroup() {
        return GroupedOpenApi.builder()
                .group("subscriptions")
                .displayName("Plans, Payments & Subscription Status")
                .pathsToMatch("/api/v1/subscriptions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi videosGroup() {
        return GroupedOpenApi.builder()
                .group("videos")
                .displayName("Video Catalogue")
                .pathsToMatch("/api/v1/videos/**")
                .build();
    }
}
