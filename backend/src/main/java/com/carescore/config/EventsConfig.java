package com.carescore.config;

import com.carescore.integration.ApplicationEventClinicalEventPublisher;
import com.carescore.integration.ClinicalEventFactory;
import com.carescore.integration.ClinicalEventPublisher;
import com.carescore.integration.DisabledInsightGenerator;
import com.carescore.integration.InsightGenerator;
import com.carescore.integration.KafkaClinicalEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

/**
 * Event transport and AI collaborator wiring.
 * {@code carescore.events.transport} picks the publisher: "local" (default) or "kafka".
 */
@Slf4j
@Configuration
public class EventsConfig {

    @Bean
    public ClinicalEventFactory clinicalEventFactory(Clock clock) {
        return new ClinicalEventFactory(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "carescore.events.transport", havingValue = "local", matchIfMissing = true)
    public ClinicalEventPublisher localClinicalEventPublisher(
            ApplicationEventPublisher applicationEventPublisher,
            ClinicalEventFactory eventFactory) {
        log.info("Clinical events published in-process");
        return new ApplicationEventClinicalEventPublisher(applicationEventPublisher, eventFactory);
    }

    @Bean
    @ConditionalOnProperty(name = "carescore.events.transport", havingValue = "kafka")
    public ClinicalEventPublisher kafkaClinicalEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            ClinicalEventFactory eventFactory,
            CareScoreProperties properties) {
        log.info("Clinical events published to Kafka with topic prefix '{}'", properties.getEvents().getTopicPrefix());
        return new KafkaClinicalEventPublisher(kafkaTemplate, objectMapper, eventFactory, properties.getEvents().getTopicPrefix());
    }

    /**
     * No insight provider configured: results carry empty insights.
     */
    @Bean
    @ConditionalOnMissingBean(InsightGenerator.class)
    public InsightGenerator insightGenerator() {
        return new DisabledInsightGenerator();
    }
}
