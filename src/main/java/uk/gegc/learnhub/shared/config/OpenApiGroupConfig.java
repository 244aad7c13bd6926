package uk.gegc.learnhub.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the shared bearer-token scheme.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI learnHubOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("LearnHub API")
                        .description("Purchases, payment verification and payment gateway webhooks")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi purchasesGroup() {
        return GroupedOpenApi.builder()
                .group("purchases")
                .displayName("Purchases & Payments")
                .pathsToMatch("/api/v1/purchases/**")
                .build();
    }
}
