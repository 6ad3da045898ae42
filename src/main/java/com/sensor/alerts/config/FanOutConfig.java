package com.sensor.alerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts.fan-out")
public class FanOutConfig {
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 200;
    private long recipientTimeoutMs = 10000;     // 10 seconds
}
