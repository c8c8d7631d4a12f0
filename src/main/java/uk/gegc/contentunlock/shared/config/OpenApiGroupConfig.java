package uk.gegc.contentunlock.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi unlocksGroup() {
        return GroupedOpenApi.builder()
                .group("unlocks")
                .displayName("Unlocks")
                .pathsToMatch("/api/v1/unlocks/**", "/api/v1/admin/unlocks/**")
                .build();
    }

    @Bean
    public GroupedOpenApi creditsGroup() {
        return GroupedOpenApi.builder()
                .group("credits")
                .displayName("Credits & Ledger")
                .pathsToMatch("/api/v1/admin/credits/**")
                .build();
    }
}
