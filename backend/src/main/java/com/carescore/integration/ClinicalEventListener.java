package com.carescore.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Receives locally published events. Risk alerts are logged at WARN so they reach operators
 * even without a broker.
 */
@Slf4j
@Component
public class ClinicalEventListener {

    @EventListener
    public void onClinicalEvent(ClinicalDomainEvent event) {
        if (EventTypes.RISK_ALERT.equals(event.eventType())) {
            log.warn("Risk alert event {} for patient {}", event.eventId(), event.key());
        } else {
            log.info("Event {} ({}) for patient {}", event.eventType(), event.eventId(), event.key());
        }
    }
}
