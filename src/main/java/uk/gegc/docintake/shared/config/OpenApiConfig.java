package uk.gegc.docintake.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI docIntakeOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("DocIntake API")
                        .description("Document upload, bulk user import, AI-assisted analysis and audit log")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi documentsGroup() {
        return GroupedOpenApi.builder()
                .group("documents")
                .displayName("Documents")
                .pathsToMatch("/api/v1/documents/**")
                .build();
    }

    @Bean
    public GroupedOpenApi auditGroup() {
        return GroupedOpenApi.builder()
                .group("audit")
                .displayName("Audit & Live Events")
                .pathsToMatch("/api/v1/audit-events/**", "/api/v1/live/**")
                .build();
    }

    @Bean
    public GroupedOpenApi authGroup() {
        return GroupedOpenApi.builder()
                .group("auth")
                .displayName("Authentication")
                .pathsToMatch("/api/v1/auth/**")
                .build();
    }
}
