package com.sensor.alerts.repository;

import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.config.AerospikeConfig;
import com.sensor.alerts.model.StoredAlertRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Per-user alert history. Each record is its own Aerospike key; the owning
 * user is kept in the {@code userId} bin.
 */
@Repository
public class AlertRecordRepository {

    private final AerospikeBackend backend;
    private final String namespace;
    private final WritePolicy createPolicy;
    private final ObjectMapper objectMapper;

    public AlertRecordRepository(AerospikeBackend backend,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.backend = backend;
        this.namespace = namespace;
        this.createPolicy = new WritePolicy(writePolicy);
        this.createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.objectMapper = new ObjectMapper();
    }

    public boolean isAvailable() {
        return backend.isAvailable();
    }

    /**
     * Appends a record for {@code record.getUserId()} and returns the
     * generated id, which is also set on the record.
     */
    public String append(StoredAlertRecord record) {
        String id = UUID.randomUUID().toString();
        record.setId(id);
        Key key = new Key(namespace, AerospikeConfig.SET_ML_ALERTS, id);

        backend.client().put(createPolicy, key,
                new Bin("id", id),
                new Bin("deviceId", record.getDeviceId()),
                new Bin("deviceIdent", record.getDeviceIdentifier()),
                new Bin("userId", record.getUserId()),
                new Bin("notifType", record.getNotificationType()),
                new Bin("detectedObjects", toJson(record.getDetectedObjects())),
                new Bin("riskLabel", record.getRiskLabel()),
                new Bin("predictedRisk", record.getPredictedRisk()),
                new Bin("description", toJson(record.getDescription())),
                new Bin("screenshots", toJson(record.getScreenshots())),
                new Bin("storedAt", record.getStoredAt()),
                record.getAlertGeneratedAt() != null
                        ? new Bin("alertGenAt", record.getAlertGeneratedAt())
                        : Bin.asNull("alertGenAt"),
                new Bin("modelVersion", record.getModelVersion()),
                record.getConfidenceScore() != null
                        ? new Bin("confidenceScore", record.getConfidenceScore())
                        : Bin.asNull("confidenceScore"),
                new Bin("acknowledged", record.isAcknowledged()),
                Bin.asNull("rating"),
                Bin.asNull("ratingAccuracy"),
                new Bin("additionalData", toJson(record.getAdditionalData())));
        return id;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Alert field is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
