package com.company.sla.dto.response;

import com.company.sla.domain.enums.BreachType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time SLA status of one task. Nothing is persisted when this is computed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaCheckResult {
    private String slaId;
    private boolean breached;
    private BreachType breachType;
    private Instant deadlineAt;
    private long elapsedMinutes;
    // Negative once the target deadline has passed
    private long remainingMinutes;
}
