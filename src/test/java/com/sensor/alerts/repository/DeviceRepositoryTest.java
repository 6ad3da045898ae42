package com.sensor.alerts.repository;

import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.model.Device;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceRepositoryTest {

    @Mock
    private IAerospikeClient client;

    private final Policy readPolicy = new Policy();
    private DeviceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DeviceRepository(new AerospikeBackend(client), "sensor", readPolicy);
    }

    @Test
    void findById_readsOwnerFromDevicesSet() {
        when(client.get(eq(readPolicy), any(Key.class)))
                .thenReturn(new Record(Map.of("userId", "u2"), 1, 0));

        Optional<Device> device = repository.findById("d1");

        assertThat(device).isPresent();
        assertThat(device.get().getDeviceId()).isEqualTo("d1");
        assertThat(device.get().getOwnerUserId()).isEqualTo("u2");

        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        verify(client).get(eq(readPolicy), keyCaptor.capture());
        assertThat(keyCaptor.getValue().namespace).isEqualTo("sensor");
        assertThat(keyCaptor.getValue().setName).isEqualTo("devices");
        assertThat(keyCaptor.getValue().userKey.toString()).isEqualTo("d1");
    }

    @Test
    void findById_missingRecord_empty() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(repository.findById("unknown")).isEmpty();
    }

    @Test
    void findById_unclaimedDevice_nullOwner() {
        when(client.get(eq(readPolicy), any(Key.class)))
                .thenReturn(new Record(Map.of("name", "front door"), 1, 0));

        assertThat(repository.findById("d1")).hasValueSatisfying(d -> assertThat(d.getOwnerUserId()).isNull());
    }

    @Test
    void disabledBackend_unavailable() {
        DeviceRepository offline = new DeviceRepository(AerospikeBackend.disabled(), "sensor", readPolicy);

        assertThat(offline.isAvailable()).isFalse();
        assertThatThrownBy(() -> offline.findById("d1")).isInstanceOf(IllegalStateException.class);
    }
}
