package com.carescore.integration;

import org.slf4j.MDC;

import java.time.Clock;
import java.util.UUID;

/**
 * Wraps payloads in {@link ClinicalDomainEvent} envelopes.
 */
public class ClinicalEventFactory {

    private final Clock clock;

    public ClinicalEventFactory(Clock clock) {
        this.clock = clock;
    }

    public ClinicalDomainEvent create(String eventType, Object payload, PublishOptions options) {
        PublishOptions effective = options == null ? new PublishOptions(null, "normal") : options;
        return new ClinicalDomainEvent(
            "evt-" + UUID.randomUUID(),
            eventType,
            effective.key(),
            effective.priority(),
            MDC.get("requestId"),
            clock.instant(),
            payload
        );
    }
}
