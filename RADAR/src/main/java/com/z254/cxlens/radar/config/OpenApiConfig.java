package com.z254.cxlens.radar.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for RADAR service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI radarOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("RADAR CX Regression Service API")
                        .description("""
                                RADAR detects customer-experience regressions and explains them.
                                
                                ## Features
                                
                                - **Detection**: Consensus anomaly detection over bucketed CX metrics
                                - **Slicing**: Cohort slices that drive a regression, with significance
                                - **Incidents**: Idempotent incident lifecycle
                                - **RCA**: Hypotheses ranked by causal evidence and impact
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("cx-lens Team"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://radar-service:8090")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Observations")
                                .description("Order observation ingestion"),
                        new Tag()
                                .name("Detection")
                                .description("Anomaly detection runs"),
                        new Tag()
                                .name("Incidents")
                                .description("Incident management and querying"),
                        new Tag()
                                .name("RCA")
                                .description("Root Cause Analysis operations"),
                        new Tag()
                                .name("Hypotheses")
                                .description("Causal hypothesis catalog")
                ));
    }
}
