package com.sensor.alerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "push")
public class PushGatewayConfig {

    private boolean enabled = false;
    private String gatewayUrl = "https://exp.host/--/api/v2/push/send";
    private String accessToken;
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 10000;
}
