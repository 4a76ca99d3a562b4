package com.carescore.integration;

/**
 * Best-effort, fire-and-forget publication of domain events. Implementations never throw;
 * a lost event must not fail the operation that produced it.
 */
public interface ClinicalEventPublisher {

    void publish(String eventType, Object payload, PublishOptions options);
}
