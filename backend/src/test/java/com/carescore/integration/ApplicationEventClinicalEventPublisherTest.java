package com.carescore.integration;

import com.carescore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApplicationEventClinicalEventPublisher Unit Tests")
class ApplicationEventClinicalEventPublisherTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ApplicationEventClinicalEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new ApplicationEventClinicalEventPublisher(
            applicationEventPublisher, new ClinicalEventFactory(MutableClock.at("2026-03-02T09:00:00Z")));
    }

    @Test
    @DisplayName("Should publish an envelope with default options when none are given")
    void shouldPublishEnvelope() {
        // When
        publisher.publish(EventTypes.PROGRESS_CREATED, Map.of("recordId", "prog-1"), null);

        // Then
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue()).isInstanceOf(ClinicalDomainEvent.class);
        ClinicalDomainEvent event = (ClinicalDomainEvent) captor.getValue();
        assertThat(event.eventType()).isEqualTo(EventTypes.PROGRESS_CREATED);
        assertThat(event.priority()).isEqualTo("normal");
        assertThat(event.key()).isNull();
        assertThat(event.occurredAt()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    @DisplayName("Should swallow listener failures")
    void shouldNotThrowOnListenerFailure() {
        doThrow(new IllegalStateException("listener broke")).when(applicationEventPublisher).publishEvent(any(Object.class));

        assertThatCode(() -> publisher.publish(EventTypes.RISK_ALERT, Map.of(), PublishOptions.urgent("patient-1")))
            .doesNotThrowAnyException();
    }
}
