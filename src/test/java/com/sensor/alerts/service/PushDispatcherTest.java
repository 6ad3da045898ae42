package com.sensor.alerts.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sensor.alerts.config.FanOutConfig;
import com.sensor.alerts.config.MetricsConfig;
import com.sensor.alerts.model.Alert;
import com.sensor.alerts.model.BlockStatus;
import com.sensor.alerts.model.PushMessage;
import com.sensor.alerts.model.PushOutcome;
import com.sensor.alerts.repository.UserProfileRepository;
import com.sensor.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PushDispatcherTest {

    @Mock private PushGatewayClient pushGatewayClient;
    @Mock private BlockRegistry blockRegistry;
    @Mock private UserProfileRepository userProfileRepository;
    @Mock private MetricsConfig metricsConfig;

    private PushDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        RecipientFanOut fanOut = new RecipientFanOut(Runnable::run, new FanOutConfig());
        dispatcher = new PushDispatcher(pushGatewayClient, blockRegistry, userProfileRepository, fanOut, metricsConfig);
    }

    @Test
    void dispatch_gatewayNotInitialized_returnsEmpty() {
        when(pushGatewayClient.isInitialized()).thenReturn(false);

        List<PushOutcome> outcomes = dispatcher.dispatch(
                TestDataFactory.createAlert("d1", "High", "person"), TestDataFactory.createContent(), List.of("u2"));

        assertThat(outcomes).isEmpty();
        verifyNoInteractions(blockRegistry, userProfileRepository);
    }

    @Test
    void dispatch_registeredRecipient_sendsMessageWithAlertData() {
        Alert alert = TestDataFactory.createAlert("cam-1", "Critical", "person", "car");
        ObjectNode gatewayResponse = JsonNodeFactory.instance.objectNode();
        gatewayResponse.putObject("data").put("status", "ok");

        when(pushGatewayClient.isInitialized()).thenReturn(true);
        when(blockRegistry.checkBlocked("u2")).thenReturn(BlockStatus.notBlocked());
        when(userProfileRepository.findPushToken("u2")).thenReturn(Optional.of("TOK"));
        when(pushGatewayClient.send(any(PushMessage.class))).thenReturn(gatewayResponse);

        List<PushOutcome> outcomes = dispatcher.dispatch(alert, TestDataFactory.createContent(), List.of("u2"));

        assertThat(outcomes).hasSize(1);
        assertThat(outcomes.get(0).getKind()).isEqualTo(PushOutcome.Kind.DELIVERED);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(0).getResult()).isEqualTo(gatewayResponse);

        ArgumentCaptor<PushMessage> captor = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushGatewayClient).send(captor.capture());
        PushMessage message = captor.getValue();
        assertThat(message.getTo()).isEqualTo("TOK");
        assertThat(message.getTitle()).isEqualTo("🔴 Critical Alert - d1");
        assertThat(message.getBody()).isEqualTo("person: x");
        assertThat(message.getBadge()).isEqualTo(1);
        assertThat(message.getSound()).isEqualTo("default");
        assertThat(message.getData())
                .containsEntry("type", "mlAlert")
                .containsEntry("deviceId", "cam-1")
                .containsEntry("riskLabel", "Critical")
                .containsEntry("detectedObjects", "person, car")
                .containsEntry("timestamp", "1000")
                .containsKey("alertId");
        assertThat(message.getData().get("alertId")).isNotBlank();
    }

    @Test
    void dispatch_clientSuppliedAlertId_usedAsCorrelationId() {
        Alert alert = TestDataFactory.createAlertWithClientId("cam-1", "alert-42");
        when(pushGatewayClient.isInitialized()).thenReturn(true);
        when(blockRegistry.checkBlocked("u2")).thenReturn(BlockStatus.notBlocked());
        when(userProfileRepository.findPushToken("u2")).thenReturn(Optional.of("TOK"));
        when(pushGatewayClient.send(any(PushMessage.class))).thenReturn(JsonNodeFactory.instance.objectNode());

        dispatcher.dispatch(alert, TestDataFactory.createContent(), List.of("u2"));

        ArgumentCaptor<PushMessage> captor = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushGatewayClient).send(captor.capture());
        assertThat(captor.getValue().getData()).containsEntry("alertId", "alert-42");
    }

    @Test
    void dispatch_classifiesEachRecipientExactlyOnceInInputOrder() {
        when(pushGatewayClient.isInitialized()).thenReturn(true);
        when(blockRegistry.checkBlocked("blocked")).thenReturn(TestDataFactory.createBlock("abuse"));
        when(blockRegistry.checkBlocked("no-token")).thenReturn(BlockStatus.notBlocked());
        when(blockRegistry.checkBlocked("ok")).thenReturn(BlockStatus.notBlocked());
        when(blockRegistry.checkBlocked("broken")).thenReturn(BlockStatus.notBlocked());
        when(userProfileRepository.findPushToken("no-token")).thenReturn(Optional.empty());
        when(userProfileRepository.findPushToken("ok")).thenReturn(Optional.of("TOK-OK"));
        when(userProfileRepository.findPushToken("broken")).thenReturn(Optional.of("TOK-BROKEN"));
        JsonNode delivered = JsonNodeFactory.instance.objectNode().put("status", "ok");
        when(pushGatewayClient.send(argThat(m -> m != null && "TOK-OK".equals(m.getTo())))).thenReturn(delivered);
        when(pushGatewayClient.send(argThat(m -> m != null && "TOK-BROKEN".equals(m.getTo()))))
                .thenThrow(new ResourceAccessException("Read timed out"));

        List<PushOutcome> outcomes = dispatcher.dispatch(
                TestDataFactory.createAlert("d1", "High", "person"),
                TestDataFactory.createContent(),
                List.of("blocked", "no-token", "ok", "broken"));

        assertThat(outcomes).extracting(PushOutcome::getUserId)
                .containsExactly("blocked", "no-token", "ok", "broken");
        assertThat(outcomes).extracting(PushOutcome::getKind)
                .containsExactly(PushOutcome.Kind.BLOCKED, PushOutcome.Kind.SKIPPED,
                        PushOutcome.Kind.DELIVERED, PushOutcome.Kind.ERROR);

        for (PushOutcome outcome : outcomes) {
            int markers = (outcome.getBlocked() != null ? 1 : 0)
                    + (outcome.getSkipped() != null ? 1 : 0)
                    + (outcome.getResult() != null ? 1 : 0)
                    + (outcome.getError() != null ? 1 : 0);
            assertThat(markers).as("outcome markers for %s", outcome.getUserId()).isEqualTo(1);
        }

        assertThat(outcomes.get(0).getReason()).isEqualTo("abuse");
        assertThat(outcomes.get(3).getError()).isEqualTo("Read timed out");
        assertThat(outcomes).filteredOn(PushOutcome::isSuccess).hasSize(1);
    }

    @Test
    void dispatch_blockedRecipient_neverLooksUpToken() {
        when(pushGatewayClient.isInitialized()).thenReturn(true);
        when(blockRegistry.checkBlocked("u2")).thenReturn(TestDataFactory.createBlock("abuse"));

        dispatcher.dispatch(TestDataFactory.createAlert("d1", "High", "person"),
                TestDataFactory.createContent(), List.of("u2"));

        verifyNoInteractions(userProfileRepository);
        verify(pushGatewayClient, never()).send(any());
    }

    @Test
    void dispatch_gatewayReplyWithoutBody_stillMarkedDelivered() {
        when(pushGatewayClient.isInitialized()).thenReturn(true);
        when(blockRegistry.checkBlocked("u2")).thenReturn(BlockStatus.notBlocked());
        when(userProfileRepository.findPushToken("u2")).thenReturn(Optional.of("TOK"));
        when(pushGatewayClient.send(any(PushMessage.class))).thenReturn(null);

        List<PushOutcome> outcomes = dispatcher.dispatch(TestDataFactory.createAlert("d1", "High", "person"),
                TestDataFactory.createContent(), List.of("u2"));

        PushOutcome outcome = outcomes.get(0);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getResult()).isNotNull();
        assertThat(outcome.getBlocked()).isNull();
        assertThat(outcome.getSkipped()).isNull();
        assertThat(outcome.getError()).isNull();

        JsonNode json = new ObjectMapper().valueToTree(outcome);
        assertThat(json.has("result")).isTrue();
        assertThat(json.path("result").isObject()).isTrue();
    }
}
