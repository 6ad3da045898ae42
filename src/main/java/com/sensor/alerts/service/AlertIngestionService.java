package com.sensor.alerts.service;

import com.sensor.alerts.config.MetricsConfig;
import com.sensor.alerts.model.Alert;
import com.sensor.alerts.model.AlertIngestionResponse;
import com.sensor.alerts.model.AlertRequest;
import com.sensor.alerts.model.BlockStatus;
import com.sensor.alerts.model.IngestionResult;
import com.sensor.alerts.model.NotificationContent;
import com.sensor.alerts.model.PushOutcome;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Main orchestrator for inbound alerts.
 *
 * Flow:
 * 1. Validate the request shape (no side effects on failure)
 * 2. Reject the whole request if the sender is blocked
 * 3. Compose the notification content
 * 4. Store one record per eligible recipient
 * 5. Resolve recipients again and dispatch push notifications
 * 6. Aggregate the per-recipient outcomes
 */
@Service
public class AlertIngestionService {

    private static final Logger log = LoggerFactory.getLogger(AlertIngestionService.class);

    static final String MISSING_FIELDS = "Missing required fields: userId, deviceId, alert";
    static final String INVALID_ALERT = "Invalid alert data: missing detected_objects or risk_label";

    private final BlockRegistry blockRegistry;
    private final NotificationComposer notificationComposer;
    private final AlertStore alertStore;
    private final DeviceDirectory deviceDirectory;
    private final PushDispatcher pushDispatcher;
    private final MetricsConfig metricsConfig;

    public AlertIngestionService(BlockRegistry blockRegistry,
                                 NotificationComposer notificationComposer,
                                 AlertStore alertStore,
                                 DeviceDirectory deviceDirectory,
                                 PushDispatcher pushDispatcher,
                                 MetricsConfig metricsConfig) {
        this.blockRegistry = blockRegistry;
        this.notificationComposer = notificationComposer;
        this.alertStore = alertStore;
        this.deviceDirectory = deviceDirectory;
        this.pushDispatcher = pushDispatcher;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "alert.ingest", contextualName = "ingest-alert")
    public IngestionResult ingest(AlertRequest request) {
        try {
            // 1. Shape validation
            if (request == null || isMissing(request.getUserId()) || isMissing(request.getDeviceId())
                    || request.getAlert() == null) {
                metricsConfig.recordIngestion("invalid");
                return IngestionResult.invalid(MISSING_FIELDS);
            }

            Alert alert = request.getAlert();
            if (alert.getDetectedObjects() == null || alert.getDetectedObjects().isEmpty()
                    || isMissing(alert.getRiskLabel())) {
                metricsConfig.recordIngestion("invalid");
                return IngestionResult.invalid(INVALID_ALERT);
            }

            // 2. Sender gate, before any side effect
            BlockStatus senderStatus = blockRegistry.checkBlocked(request.getUserId());
            if (senderStatus.isBlocked()) {
                metricsConfig.recordIngestion("sender_blocked");
                log.warn("REJECTED alert from blocked user {}: {}", request.getUserId(), senderStatus.getReason());
                return IngestionResult.senderBlocked(senderStatus.getReason());
            }

            log.info("Received alert: user={}, device={}, type={}, risk={}, objects={}",
                    request.getUserId(), request.getDeviceId(), alert.getNotificationType(),
                    alert.getRiskLabel(), String.join(", ", alert.getDetectedObjects()));

            // 3. Notification content
            NotificationContent content = notificationComposer.compose(alert);

            // 4. Per-recipient storage
            List<String> alertIds = alertStore.persist(request.getDeviceId(), alert);

            // 5. Push dispatch, recipients resolved independently of storage
            List<String> recipients = deviceDirectory.resolveRecipients(request.getDeviceId());
            List<PushOutcome> pushResults = pushDispatcher.dispatch(alert, content, recipients);

            // 6. Aggregate
            metricsConfig.recordIngestion("accepted");
            return IngestionResult.accepted(AlertIngestionResponse.builder()
                    .success(true)
                    .message("Alert processed successfully")
                    .alertIds(alertIds)
                    .usersNotified(recipients.size())
                    .pushResults(pushResults)
                    .timestamp(Instant.now().toString())
                    .build());
        } catch (RuntimeException e) {
            metricsConfig.recordIngestion("internal_error");
            log.error("Error processing alert: {}", e.getMessage(), e);
            return IngestionResult.internalError(e.getMessage());
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isEmpty();
    }
}
