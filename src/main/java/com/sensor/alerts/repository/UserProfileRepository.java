package com.sensor.alerts.repository;

import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class UserProfileRepository {

    private static final String BIN_PUSH_TOKEN = "expoPushToken";

    private final AerospikeBackend backend;
    private final String namespace;
    private final Policy readPolicy;

    public UserProfileRepository(AerospikeBackend backend,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.backend = backend;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    /**
     * Push token registered by the user's mobile client. Empty when the user
     * has no profile, no token, or the store is unavailable.
     */
    public Optional<String> findPushToken(String userId) {
        if (!backend.isAvailable()) return Optional.empty();

        Key key = new Key(namespace, AerospikeConfig.SET_USERS, userId);
        Record record = backend.client().get(readPolicy, key, BIN_PUSH_TOKEN);
        if (record == null) return Optional.empty();

        String token = record.getString(BIN_PUSH_TOKEN);
        return token != null && !token.isBlank() ? Optional.of(token) : Optional.empty();
    }
}
