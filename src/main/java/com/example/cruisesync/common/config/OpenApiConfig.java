package com.example.cruisesync.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Vendor-facing webhook and operator endpoints are documented as separate groups.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cruiseSyncOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cruise Sync API")
                        .description("Traveltek webhook intake, sync task control and remote client operations")
                        .version("v1"));
    }

    @Bean
    public GroupedOpenApi webhookApi() {
        return GroupedOpenApi.builder()
                .group("webhooks")
                .pathsToMatch("/api/v1/webhooks/**")
                .build();
    }

    @Bean
    public GroupedOpenApi operationsApi() {
        return GroupedOpenApi.builder()
                .group("operations")
                .pathsToMatch("/api/v1/sync/**", "/api/v1/admin/**")
                .build();
    }
}
