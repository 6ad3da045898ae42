package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class NotificationContent {
    private String title;
    private String body;
    private String severityGlyph;
}
