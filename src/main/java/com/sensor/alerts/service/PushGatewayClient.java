package com.sensor.alerts.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sensor.alerts.config.PushGatewayConfig;
import com.sensor.alerts.model.PushMessage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the Expo push gateway.
 *
 * Initialized once at startup. When push is disabled or the configuration is
 * unusable the client stays uninitialized and callers skip push delivery.
 */
@Component
public class PushGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(PushGatewayClient.class);

    private final PushGatewayConfig config;
    private final RestTemplateBuilder restTemplateBuilder;

    private volatile RestTemplate restTemplate;
    private URI gatewayUri;

    public PushGatewayClient(PushGatewayConfig config, RestTemplateBuilder restTemplateBuilder) {
        this.config = config;
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("Push gateway is DISABLED.");
            return;
        }

        try {
            if (config.getGatewayUrl() == null || config.getGatewayUrl().isBlank()) {
                throw new IllegalStateException("push.gateway-url is not set");
            }
            gatewayUri = URI.create(config.getGatewayUrl());
            restTemplate = restTemplateBuilder
                    .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                    .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                    .build();
            log.info("Push gateway initialized: {}", gatewayUri);
        } catch (RuntimeException e) {
            restTemplate = null;
            log.error("Push gateway initialization failed: {}", e.getMessage());
            log.warn("Service will continue without push notifications");
        }
    }

    public boolean isInitialized() {
        return restTemplate != null;
    }

    /**
     * Sends one message and returns the gateway's JSON response.
     *
     * @throws org.springframework.web.client.RestClientException on transport or HTTP errors
     */
    public JsonNode send(PushMessage message) {
        if (restTemplate == null) {
            throw new IllegalStateException("Push gateway is not initialized");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.getAccessToken() != null && !config.getAccessToken().isBlank()) {
            headers.setBearerAuth(config.getAccessToken());
        }

        return restTemplate.postForObject(gatewayUri, new HttpEntity<>(message, headers), JsonNode.class);
    }
}
