package com.sensor.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregated result of an accepted alert")
public class AlertIngestionResponse {

    private boolean success;

    @Schema(example = "Alert processed successfully")
    private String message;

    @Schema(description = "Ids of the stored per-recipient alert records")
    private List<String> alertIds;

    @Schema(description = "Number of recipients resolved for the device", example = "1")
    private int usersNotified;

    private List<PushOutcome> pushResults;

    @Schema(description = "Processing time, ISO-8601", example = "2025-02-18T13:52:44.120Z")
    private String timestamp;
}
