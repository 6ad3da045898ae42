package com.sensor.alerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts.block-registry")
public class BlockRegistryConfig {
    private int queryTimeoutSeconds = 3;
}
