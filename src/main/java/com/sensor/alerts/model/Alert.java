package com.sensor.alerts.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A detection alert emitted by a field device")
public class Alert {

    @JsonProperty("notification_type")
    @Schema(description = "Notification type tag", example = "ml_detection")
    private String notificationType;

    @JsonProperty("detected_objects")
    @Schema(description = "Objects detected in the frame, in detection order", example = "[\"person\", \"car\"]")
    private List<String> detectedObjects;

    @JsonProperty("risk_label")
    @Schema(description = "Risk label (Low, Medium, High, Critical; case-insensitive)", example = "Critical")
    private String riskLabel;

    @JsonProperty("predicted_risk")
    @Schema(description = "Model risk prediction", example = "intrusion")
    private String predictedRisk;

    @Schema(description = "Human readable description lines; the first one is used in the notification body")
    private List<String> description;

    @JsonProperty("device_identifier")
    @Schema(description = "Identifier the device reports for itself", example = "cam-front-door")
    private String deviceIdentifier;

    @Schema(description = "Alert generation time in epoch seconds, as reported by the device", example = "1739886764")
    private Long timestamp;

    @JsonProperty("model_version")
    @Schema(description = "Detection model version", example = "v1.4.2")
    private String modelVersion;

    @JsonProperty("confidence_score")
    @Schema(description = "Model confidence in [0, 1]", example = "0.92")
    private Double confidenceScore;

    @JsonProperty("screenshot")
    @Schema(description = "Opaque screenshot references")
    private List<String> screenshots;

    @JsonProperty("additional_data")
    @Schema(description = "Free-form extra data; may carry a client supplied alert_id")
    private Map<String, Object> additionalData;

    /**
     * Returns the correlation id supplied by the device in
     * {@code additional_data.alert_id}, or null if absent.
     */
    @JsonIgnore
    public String getClientAlertId() {
        if (additionalData == null) return null;
        Object id = additionalData.get("alert_id");
        return id != null ? id.toString() : null;
    }

    @JsonIgnore
    public List<String> getDescriptionOrEmpty() {
        return description != null ? description : Collections.emptyList();
    }
}
