package com.sensor.alerts.model;

public enum IngestionStatus {
    ACCEPTED,
    INVALID,
    SENDER_BLOCKED,
    INTERNAL_ERROR
}
