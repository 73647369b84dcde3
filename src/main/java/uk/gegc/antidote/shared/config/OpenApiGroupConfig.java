package uk.gegc.antidote.shared.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups. Clinic-facing and admin endpoints are documented separately.
 */
@Configuration
@SecurityScheme(name = "Basic Authentication", type = SecuritySchemeType.HTTP, scheme = "basic")
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi billingGroup() {
        return GroupedOpenApi.builder()
                .group("billing")
                .displayName("Clinic Billing & Payments")
                .pathsToMatch("/api/v1/billing/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Billing Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
