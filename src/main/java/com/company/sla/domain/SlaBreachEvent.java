package com.company.sla.domain;

import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.TriggeredBy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Write-once audit row for a breach state transition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaBreachEvent {
    private String id;
    private String breachId;
    private BreachEventType eventType;
    private Map<String, Object> eventData;
    private TriggeredBy triggeredBy;
    private String userId;
    private Instant createdAt;
}
