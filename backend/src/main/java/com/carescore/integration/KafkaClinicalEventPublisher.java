package com.carescore.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes events as JSON to {@code <topicPrefix><eventType>}, keyed by patient id so that
 * events of one patient stay ordered.
 */
@Slf4j
public class KafkaClinicalEventPublisher implements ClinicalEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ClinicalEventFactory eventFactory;
    private final String topicPrefix;

    public KafkaClinicalEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            ClinicalEventFactory eventFactory,
            String topicPrefix) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.eventFactory = eventFactory;
        this.topicPrefix = topicPrefix == null ? "" : topicPrefix;
    }

    @Override
    public void publish(String eventType, Object payload, PublishOptions options) {
        ClinicalDomainEvent event = eventFactory.create(eventType, payload, options);
        String topic = topicFor(eventType);
        try {
            String json = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, event.key(), json)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish {} to {}: {}", event.eventId(), topic, ex.getMessage());
                    } else {
                        log.debug("Published {} to {}", event.eventId(), topic);
                    }
                });
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event {}: {}", eventType, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to hand event {} to Kafka: {}", eventType, e.getMessage());
        }
    }

    String topicFor(String eventType) {
        return topicPrefix + eventType;
    }
}
