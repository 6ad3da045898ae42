package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Terminal outcome of one ingestion request. {@code response} is set only
 * when accepted, {@code error} otherwise.
 */
@Data
@AllArgsConstructor
public class IngestionResult {

    private IngestionStatus status;
    private AlertIngestionResponse response;
    private ErrorResponse error;

    public static IngestionResult accepted(AlertIngestionResponse response) {
        return new IngestionResult(IngestionStatus.ACCEPTED, response, null);
    }

    public static IngestionResult invalid(String error) {
        return new IngestionResult(IngestionStatus.INVALID, null, ErrorResponse.of(error));
    }

    public static IngestionResult senderBlocked(String reason) {
        return new IngestionResult(IngestionStatus.SENDER_BLOCKED, null, ErrorResponse.builder()
                .error("User is blocked and cannot send alerts")
                .reason(reason)
                .build());
    }

    public static IngestionResult internalError(String message) {
        return new IngestionResult(IngestionStatus.INTERNAL_ERROR, null, ErrorResponse.builder()
                .error("Internal server error")
                .message(message)
                .build());
    }
}
