package com.carescore.integration;

import java.time.Instant;

/**
 * Envelope for everything the service publishes.
 */
public record ClinicalDomainEvent(
    String eventId,
    String eventType,
    String key,
    String priority,
    String requestId,
    Instant occurredAt,
    Object payload
) {}
