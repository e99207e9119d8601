package com.waypoint.router.config;

import com.waypoint.router.catalog.RegionCatalog;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String SECURITY_SCHEME = "ApiKeyBearer";

    @Bean
    public OpenAPI waypointOpenAPI(RegionCatalog catalog, @Value("${waypoint.security.api-keys:}") String apiKeys) {
        return new OpenAPI()
                .info(new Info()
                        .title("Waypoint Region Router API")
                        .description(String.format(
                                "Picks a deployment region per request (strategy: %s, %d active regions) and "
                                        + "takes success/failure feedback from real traffic. Status endpoints expose "
                                        + "region health and circuit breaker state.",
                                catalog.routingPolicy().strategy().value(), catalog.activeRegions().size()))
                        .version("1.0.0")
                        .contact(new Contact().name("Waypoint Engineering")))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("API key")
                                .description(securityDescription(SecurityConfig.parseKeys(apiKeys).size()))));
    }

    static String securityDescription(int configuredKeys) {
        String accepted = configuredKeys == 0
                ? "No keys are configured, so any non-blank key is accepted."
                : "The key must match one of the " + configuredKeys + " keys listed in waypoint.security.api-keys.";
        return "Send Authorization: Bearer <key> on every /api/** call. " + accepted
                + " /health, /actuator/** and the API docs need no key.";
    }
}
