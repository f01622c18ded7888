package com.z254.prism.config;

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
 * OpenAPI documentation configuration for PRISM service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8087}")
    private int serverPort;

    @Bean
    public OpenAPI prismOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PRISM Telemetry Diagnostics API")
                        .description("""
                                PRISM turns monitoring telemetry into diagnostic signals.

                                ## Features

                                - **Baselines**: Save per-datapoint statistics and report deviation from them
                                - **Change Correlation**: Match configuration changes to alert spikes
                                - **Blast Radius**: Score downstream impact of a failing device
                                - **Trends**: Forecast threshold breaches, change points, seasonality

                                All data is read on demand from the monitoring REST API.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("PRISM Team")
                                .email("prism@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://prism-service:8087")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Baselines")
                                .description("Metric baseline capture and comparison"),
                        new Tag()
                                .name("Correlation")
                                .description("Change to alert spike correlation"),
                        new Tag()
                                .name("Topology")
                                .description("Blast radius analysis"),
                        new Tag()
                                .name("Trends")
                                .description("Forecasting and anomaly analysis")
                ));
    }
}
