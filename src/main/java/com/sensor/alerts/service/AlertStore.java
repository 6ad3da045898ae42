package com.sensor.alerts.service;

import com.sensor.alerts.config.MetricsConfig;
import com.sensor.alerts.model.Alert;
import com.sensor.alerts.model.BlockStatus;
import com.sensor.alerts.model.StoredAlertRecord;
import com.sensor.alerts.repository.AlertRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Writes one alert record per eligible recipient of a device.
 *
 * Flow:
 * 1. Resolve recipients through the DeviceDirectory (failures propagate)
 * 2. Re-check each recipient against the BlockRegistry; blocked ones are skipped
 * 3. Append a record per remaining recipient; a failed write only loses that recipient
 */
@Service
public class AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    private final DeviceDirectory deviceDirectory;
    private final BlockRegistry blockRegistry;
    private final AlertRecordRepository alertRecordRepository;
    private final RecipientFanOut fanOut;
    private final MetricsConfig metricsConfig;

    public AlertStore(DeviceDirectory deviceDirectory,
                      BlockRegistry blockRegistry,
                      AlertRecordRepository alertRecordRepository,
                      RecipientFanOut fanOut,
                      MetricsConfig metricsConfig) {
        this.deviceDirectory = deviceDirectory;
        this.blockRegistry = blockRegistry;
        this.alertRecordRepository = alertRecordRepository;
        this.fanOut = fanOut;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return ids of the records that were written, in recipient order
     */
    public List<String> persist(String deviceId, Alert alert) {
        if (!alertRecordRepository.isAvailable()) {
            log.warn("Alert store unavailable, skipping storage for device={}", deviceId);
            return Collections.emptyList();
        }

        List<String> recipients = deviceDirectory.resolveRecipients(deviceId);
        if (recipients.isEmpty()) {
            log.warn("No users found for device: {}", deviceId);
            return Collections.emptyList();
        }

        log.info("Storing alert for {} user(s) of device={}", recipients.size(), deviceId);

        return fanOut.map(recipients,
                        userId -> storeFor(userId, deviceId, alert),
                        (userId, error) -> {
                            metricsConfig.recordStored("error");
                            log.error("Error storing alert for user={}: {}", userId, error.getMessage(), error);
                            return Optional.<String>empty();
                        })
                .stream()
                .flatMap(Optional::stream)
                .toList();
    }

    private Optional<String> storeFor(String userId, String deviceId, Alert alert) {
        BlockStatus blockStatus = blockRegistry.checkBlocked(userId);
        if (blockStatus.isBlocked()) {
            metricsConfig.recordStored("blocked");
            log.info("Skipping alert storage for blocked user {}: {}", userId, blockStatus.getReason());
            return Optional.empty();
        }

        StoredAlertRecord record = StoredAlertRecord.builder()
                .deviceId(deviceId)
                .deviceIdentifier(alert.getDeviceIdentifier())
                .userId(userId)
                .notificationType(alert.getNotificationType())
                .detectedObjects(alert.getDetectedObjects())
                .riskLabel(alert.getRiskLabel())
                .predictedRisk(alert.getPredictedRisk())
                .description(alert.getDescriptionOrEmpty())
                .screenshots(alert.getScreenshots() != null ? alert.getScreenshots() : Collections.emptyList())
                .storedAt(System.currentTimeMillis())
                .alertGeneratedAt(alert.getTimestamp())
                .modelVersion(alert.getModelVersion())
                .confidenceScore(alert.getConfidenceScore())
                .acknowledged(false)
                .rating(null)
                .ratingAccuracy(null)
                .additionalData(alert.getAdditionalData() != null ? alert.getAdditionalData() : Collections.emptyMap())
                .build();

        String id = alertRecordRepository.append(record);
        metricsConfig.recordStored("stored");
        log.info("Alert stored for user {}: {}", userId, id);
        return Optional.of(id);
    }
}
