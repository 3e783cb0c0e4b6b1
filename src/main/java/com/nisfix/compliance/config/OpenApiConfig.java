package com.nisfix.compliance.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI nisfixOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("NisFix Supplier Compliance API")
                        .description("""
                                Multi-tenant backend for supplier compliance management.

                                ## Features
                                - Passwordless sign-in with single-use magic links
                                - Supplier invitations and relationship lifecycle
                                - Questionnaire and document requirements with scoring
                                - Review workflow with full status history

                                ## Authentication
                                Request a link with `/api/v1/auth/magic-link`, exchange it at `/api/v1/auth/verify`
                                and send the access token as a Bearer token.
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
