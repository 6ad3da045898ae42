package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Per-recipient copy of an alert as kept in the recipient's alert history.
 * {@code storedAt} is assigned by this service and orders the history;
 * {@code alertGeneratedAt} is the device-reported timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredAlertRecord {

    private String id;
    private String deviceId;
    private String deviceIdentifier;
    private String userId;
    private String notificationType;
    private List<String> detectedObjects;
    private String riskLabel;
    private String predictedRisk;
    private List<String> description;
    private List<String> screenshots;
    private long storedAt;
    private Long alertGeneratedAt;
    private String modelVersion;
    private Double confidenceScore;
    private boolean acknowledged;
    private Integer rating;
    private String ratingAccuracy;
    private Map<String, Object> additionalData;
}
