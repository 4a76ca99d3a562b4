package com.carescore.integration;

import com.carescore.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaClinicalEventPublisher Unit Tests")
class KafkaClinicalEventPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private KafkaClinicalEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new KafkaClinicalEventPublisher(
            kafkaTemplate, objectMapper, new ClinicalEventFactory(MutableClock.at("2026-03-02T09:00:00Z")), "carescore.");
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should send a JSON envelope keyed by patient to the prefixed topic")
    void shouldPublishEnvelope() throws Exception {
        // Given
        CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(sent);
        MDC.put("requestId", "req-42");

        // When
        publisher.publish(EventTypes.RISK_ALERT, Map.of("riskType", "fall"), PublishOptions.urgent("patient-1"));

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("carescore.risk.alert"), eq("patient-1"), json.capture());
        JsonNode event = objectMapper.readTree(json.getValue());
        assertThat(event.get("eventType").asText()).isEqualTo(EventTypes.RISK_ALERT);
        assertThat(event.get("priority").asText()).isEqualTo("high");
        assertThat(event.get("requestId").asText()).isEqualTo("req-42");
        assertThat(event.get("eventId").asText()).startsWith("evt-");
        assertThat(event.get("payload").get("riskType").asText()).isEqualTo("fall");
    }

    @Test
    @DisplayName("Should swallow broker failures")
    void shouldNotThrowOnFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("broker unreachable"));

        assertThatCode(() -> publisher.publish(EventTypes.ASSESSMENT_CREATED, Map.of(), PublishOptions.forPatient("patient-1")))
            .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should tolerate a failed asynchronous send")
    void shouldTolerateFailedSend() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        assertThatCode(() -> publisher.publish(EventTypes.ASSESSMENT_CREATED, Map.of(), PublishOptions.forPatient("patient-1")))
            .doesNotThrowAnyException();
        assertThat(publisher.topicFor(EventTypes.ASSESSMENT_CREATED)).isEqualTo("carescore.assessment.created");
    }
}
