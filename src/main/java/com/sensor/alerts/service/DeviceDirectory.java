package com.sensor.alerts.service;

import com.sensor.alerts.model.Device;
import com.sensor.alerts.repository.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
public class DeviceDirectory {

    private static final Logger log = LoggerFactory.getLogger(DeviceDirectory.class);

    private final DeviceRepository deviceRepository;

    public DeviceDirectory(DeviceRepository deviceRepository) {
        this.deviceRepository = deviceRepository;
    }

    /**
     * Accounts entitled to a device's alerts; currently just the owner.
     * An unknown or unclaimed device yields an empty list. Store failures
     * propagate to the caller.
     */
    public List<String> resolveRecipients(String deviceId) {
        if (!deviceRepository.isAvailable()) {
            log.warn("Alert store unavailable, cannot resolve users for device={}", deviceId);
            return Collections.emptyList();
        }

        Optional<Device> device = deviceRepository.findById(deviceId);
        if (device.isEmpty()) {
            log.warn("Device not found: {}", deviceId);
            return Collections.emptyList();
        }

        String owner = device.get().getOwnerUserId();
        if (owner == null || owner.isBlank()) {
            log.warn("Device has no owner: {}", deviceId);
            return Collections.emptyList();
        }

        log.debug("Device {} owner: {}", deviceId, owner);
        return List.of(owner);
    }
}
