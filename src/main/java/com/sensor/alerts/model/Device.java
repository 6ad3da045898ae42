package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    private String deviceId;

    // Null when the device has been created but not yet claimed.
    private String ownerUserId;
}
