package com.sensor.alerts.controller;

import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.service.PushGatewayClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ServiceStatusController.class)
@TestPropertySource(properties = {"app.version=2.3.4", "app.environment=staging"})
class ServiceStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PushGatewayClient pushGatewayClient;

    @MockBean
    private AerospikeBackend aerospikeBackend;

    @Test
    void health_reportsDegradedBackends() throws Exception {
        when(pushGatewayClient.isInitialized()).thenReturn(false);
        when(aerospikeBackend.isAvailable()).thenReturn(true);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty())
                .andExpect(jsonPath("$.pushGateway").value(false))
                .andExpect(jsonPath("$.alertStore").value(true));
    }

    @Test
    void root_includesServiceAndVersion() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Alert API Backend"))
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").value("2.3.4"));
    }

    @Test
    void stats_reportsRuntimeInfo() throws Exception {
        when(pushGatewayClient.isInitialized()).thenReturn(true);

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.server").value("Alert API Backend"))
                .andExpect(jsonPath("$.environment").value("staging"))
                .andExpect(jsonPath("$.uptimeSeconds").isNumber())
                .andExpect(jsonPath("$.pushGateway").value(true));
    }

    @Test
    void unknownPath_404WithPath() throws Exception {
        mockMvc.perform(get("/no/such/route"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not found"))
                .andExpect(jsonPath("$.path").value("/no/such/route"));
    }
}
