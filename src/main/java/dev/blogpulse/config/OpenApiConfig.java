package dev.blogpulse.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    static final String SECURITY_SCHEME = "Bearer Authentication";

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Blog Pulse Analytics API")
                        .description("""
                                Visitor analytics for the blog.

                                ## Features
                                - Page view and engagement beacons
                                - Visitor sessions with first-touch attribution
                                - Traffic source reports
                                - Per-post engagement analytics

                                ## Authentication
                                Admin endpoints require a JWT issued by the blog's auth service:
                                `Authorization: Bearer <token>`
                                """)
                        .version(appVersion))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Development Server")))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME, new SecurityScheme()
                                .name(SECURITY_SCHEME)
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
