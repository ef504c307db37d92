package com.company.sla.domain;

import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One SLA violation (sla_breaches row). Rows are never deleted; status marks terminality.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaBreach implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String tenantId;
    private String slaId;

    // Violated work item
    private String resourceType;
    private String resourceId;

    private BreachType breachType;
    private BreachStatus status;
    private Integer currentEscalationLevel;

    private Instant detectedAt;
    private Instant deadlineAt;

    private Instant acknowledgedAt;
    private String acknowledgedBy;

    private Instant resolvedAt;
    private String resolvedBy;
    private Instant actualResolutionAt;

    // Minutes past the deadline, set at resolution
    private Integer breachDurationMinutes;

    private String notes;

    public int escalationLevel() {
        return currentEscalationLevel != null ? currentEscalationLevel : 0;
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }
}
