package com.company.sla.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One level of a policy's escalation chain (escalation_chains row)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationLevel {
    private String id;
    private String tenantId;
    private String slaId;
    private Integer level;
    private Integer escalateAfterMinutes;
    private String profileId;
    private Boolean notifyInApp;
    private Boolean reassignTask;
    private Instant createdAt;
}
