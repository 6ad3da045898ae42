package com.sensor.alerts.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sensor.alerts.config.MetricsConfig;
import com.sensor.alerts.model.Alert;
import com.sensor.alerts.model.BlockStatus;
import com.sensor.alerts.model.NotificationContent;
import com.sensor.alerts.model.PushMessage;
import com.sensor.alerts.model.PushOutcome;
import com.sensor.alerts.repository.UserProfileRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class PushDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PushDispatcher.class);

    static final String MESSAGE_TYPE = "mlAlert";

    private final PushGatewayClient pushGatewayClient;
    private final BlockRegistry blockRegistry;
    private final UserProfileRepository userProfileRepository;
    private final RecipientFanOut fanOut;
    private final MetricsConfig metricsConfig;

    public PushDispatcher(PushGatewayClient pushGatewayClient,
                          BlockRegistry blockRegistry,
                          UserProfileRepository userProfileRepository,
                          RecipientFanOut fanOut,
                          MetricsConfig metricsConfig) {
        this.pushGatewayClient = pushGatewayClient;
        this.blockRegistry = blockRegistry;
        this.userProfileRepository = userProfileRepository;
        this.fanOut = fanOut;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Sends the notification to every recipient and reports one outcome per
     * recipient, in input order. Returns an empty list when the push gateway
     * is not initialized.
     */
    @Observed(name = "push.dispatch", contextualName = "dispatch-push")
    public List<PushOutcome> dispatch(Alert alert, NotificationContent content, List<String> recipients) {
        if (!pushGatewayClient.isInitialized()) {
            log.warn("Push gateway not initialized, skipping push notifications");
            return Collections.emptyList();
        }

        Map<String, String> data = buildData(alert);

        return fanOut.map(recipients,
                userId -> dispatchTo(userId, content, data),
                (userId, error) -> {
                    metricsConfig.recordPushOutcome("error");
                    log.error("Error sending push notification to user {}: {}", userId, error.getMessage(), error);
                    return PushOutcome.failed(userId, error.getMessage());
                });
    }

    private PushOutcome dispatchTo(String userId, NotificationContent content, Map<String, String> data) {
        BlockStatus blockStatus = blockRegistry.checkBlocked(userId);
        if (blockStatus.isBlocked()) {
            metricsConfig.recordPushOutcome("blocked");
            log.info("Skipping notification for blocked user {}: {}", userId, blockStatus.getReason());
            return PushOutcome.blocked(userId, blockStatus.getReason());
        }

        Optional<String> token = userProfileRepository.findPushToken(userId);
        if (token.isEmpty()) {
            metricsConfig.recordPushOutcome("skipped");
            log.warn("No push token found for user: {}", userId);
            return PushOutcome.skipped(userId);
        }

        PushMessage message = PushMessage.builder()
                .to(token.get())
                .title(content.getTitle())
                .body(content.getBody())
                .data(data)
                .build();

        JsonNode result = pushGatewayClient.send(message);
        metricsConfig.recordPushOutcome("delivered");
        log.info("Push notification sent to user {}: {}", userId, result);
        return PushOutcome.delivered(userId, result);
    }

    private Map<String, String> buildData(Alert alert) {
        String alertId = alert.getClientAlertId() != null
                ? alert.getClientAlertId()
                : UUID.randomUUID().toString();

        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", MESSAGE_TYPE);
        data.put("deviceId", alert.getDeviceIdentifier());
        data.put("alertId", alertId);
        data.put("riskLabel", alert.getRiskLabel());
        data.put("detectedObjects", String.join(", ", alert.getDetectedObjects()));
        data.put("timestamp", String.valueOf(alert.getTimestamp()));
        return Collections.unmodifiableMap(data);
    }
}
