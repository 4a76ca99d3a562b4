package com.carescore.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Local-only delivery through Spring application events.
 */
@Slf4j
public class ApplicationEventClinicalEventPublisher implements ClinicalEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ClinicalEventFactory eventFactory;

    public ApplicationEventClinicalEventPublisher(
            ApplicationEventPublisher applicationEventPublisher,
            ClinicalEventFactory eventFactory) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.eventFactory = eventFactory;
    }

    @Override
    public void publish(String eventType, Object payload, PublishOptions options) {
        try {
            applicationEventPublisher.publishEvent(eventFactory.create(eventType, payload, options));
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} locally: {}", eventType, e.getMessage());
        }
    }
}
