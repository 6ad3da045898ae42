package com.sensor.alerts.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIngestion(String outcome) {
        Counter.builder("alert.ingest.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStored(String status) {
        Counter.builder("alert.stored.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPushOutcome(String status) {
        Counter.builder("push.outcome.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordBlockCheckFailure() {
        Counter.builder("block.check.failure.count")
                .register(registry)
                .increment();
    }
}
