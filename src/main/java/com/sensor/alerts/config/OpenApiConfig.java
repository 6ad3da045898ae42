package com.sensor.alerts.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI alertFanOutOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Alert API Backend")
                        .version("1.0.0")
                        .description(
                                "Receives detection alerts from field devices and fans them out to device owners.\n\n" +
                                "**Ingestion Pipeline:**\n" +
                                "1. Receive alert via `POST /api/alerts`\n" +
                                "2. Reject the request if the sending user is blocked\n" +
                                "3. Resolve recipients from the device owner\n" +
                                "4. Store one alert record per non-blocked recipient\n" +
                                "5. Send a push notification to each recipient with a registered token\n\n" +
                                "**Push outcomes:** `blocked`, `skipped` (no push token), delivered (`result`), `error`")
                        .contact(new Contact().name("Alert Platform Team")));
    }
}
