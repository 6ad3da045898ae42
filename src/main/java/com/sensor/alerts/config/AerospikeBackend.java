package com.sensor.alerts.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide handle on the Aerospike cluster that stores devices, user
 * profiles and per-user alert records.
 *
 * The connection is attempted exactly once. When it fails the handle stays
 * unavailable for the lifetime of the process and every repository built on
 * it behaves as a no-op.
 */
public class AerospikeBackend {

    private static final Logger log = LoggerFactory.getLogger(AerospikeBackend.class);

    private final IAerospikeClient client;

    public AerospikeBackend(IAerospikeClient client) {
        this.client = client;
    }

    public static AerospikeBackend connect(ClientPolicy policy, String host, int port) {
        try {
            AerospikeClient client = new AerospikeClient(policy, host, port);
            log.info("Aerospike alert store connected at {}:{}", host, port);
            return new AerospikeBackend(client);
        } catch (AerospikeException e) {
            log.error("Aerospike connection to {}:{} failed: {}", host, port, e.getMessage());
            log.warn("Service will continue without the alert store (device lookup and storage disabled)");
            return disabled();
        }
    }

    public static AerospikeBackend disabled() {
        return new AerospikeBackend(null);
    }

    public boolean isAvailable() {
        return client != null;
    }

    public IAerospikeClient client() {
        if (client == null) {
            throw new IllegalStateException("Aerospike alert store is not available");
        }
        return client;
    }

    public void close() {
        if (client != null) {
            client.close();
        }
    }
}
