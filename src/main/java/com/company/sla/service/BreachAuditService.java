package com.company.sla.service;

import com.company.sla.domain.SlaBreachEvent;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.TriggeredBy;
import com.company.sla.repository.SlaBreachEventRepository;
import com.company.sla.util.AttemptedEffect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Appends breach lifecycle events. A failed write is reported, never thrown:
 * the state change it describes has already committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachAuditService {

    private final SlaBreachEventRepository eventRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AttemptedEffect recordSystemEvent(String breachId, BreachEventType eventType, Map<String, Object> data) {
        return record(breachId, eventType, data, TriggeredBy.SYSTEM, null);
    }

    public AttemptedEffect record(String breachId, BreachEventType eventType, Map<String, Object> data,
                                  TriggeredBy triggeredBy, String userId) {
        SlaBreachEvent event = SlaBreachEvent.builder()
                .breachId(breachId)
                .eventType(eventType)
                .eventData(data)
                .triggeredBy(triggeredBy)
                .userId(userId)
                .createdAt(clock.instant())
                .build();

        try {
            eventRepository.append(event);
            return AttemptedEffect.succeeded(AttemptedEffect.AUDIT_EVENT);
        } catch (Exception e) {
            log.error("Failed to append {} event for breach {}", eventType.getValue(), breachId, e);
            meterRegistry.counter("sla.effects.failed", "effect", AttemptedEffect.AUDIT_EVENT).increment();
            return AttemptedEffect.failed(AttemptedEffect.AUDIT_EVENT, e);
        }
    }
}
