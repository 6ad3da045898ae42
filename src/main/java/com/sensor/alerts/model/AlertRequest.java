package com.sensor.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inbound alert submission")
public class AlertRequest {

    @Schema(description = "Account that is sending the alert", example = "user-123")
    private String userId;

    @Schema(description = "Device document id the alert belongs to", example = "device-abc")
    private String deviceId;

    private Alert alert;
}
