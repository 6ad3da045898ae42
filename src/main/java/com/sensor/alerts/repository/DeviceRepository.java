package com.sensor.alerts.repository;

import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.config.AerospikeConfig;
import com.sensor.alerts.model.Device;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class DeviceRepository {

    private final AerospikeBackend backend;
    private final String namespace;
    private final Policy readPolicy;

    public DeviceRepository(AerospikeBackend backend,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.backend = backend;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    public boolean isAvailable() {
        return backend.isAvailable();
    }

    public Optional<Device> findById(String deviceId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DEVICES, deviceId);
        Record record = backend.client().get(readPolicy, key);
        if (record == null) return Optional.empty();

        return Optional.of(Device.builder()
                .deviceId(deviceId)
                .ownerUserId(record.getString("userId"))
                .build());
    }
}
