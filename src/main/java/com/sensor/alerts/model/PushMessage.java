package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request body of a single push gateway send.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushMessage {

    private String to;
    private String title;
    private String body;
    private Map<String, String> data;

    @Builder.Default
    private int badge = 1;

    @Builder.Default
    private String sound = "default";
}
