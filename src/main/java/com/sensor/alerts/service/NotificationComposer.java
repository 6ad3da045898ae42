package com.sensor.alerts.service;

import com.sensor.alerts.model.Alert;
import com.sensor.alerts.model.NotificationContent;
import com.sensor.alerts.model.RiskSeverity;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NotificationComposer {

    static final String OBJECT_SEPARATOR = ", ";
    static final String DEFAULT_DESCRIPTION = "Alert detected";

    public NotificationContent compose(Alert alert) {
        String glyph = RiskSeverity.glyphFor(alert.getRiskLabel());
        String title = String.format("%s %s Alert - %s",
                glyph, alert.getRiskLabel(), alert.getDeviceIdentifier());

        List<String> description = alert.getDescriptionOrEmpty();
        String detail = description.isEmpty() || description.get(0) == null || description.get(0).isEmpty()
                ? DEFAULT_DESCRIPTION
                : description.get(0);
        String body = String.join(OBJECT_SEPARATOR, alert.getDetectedObjects()) + ": " + detail;

        return new NotificationContent(title, body, glyph);
    }
}
