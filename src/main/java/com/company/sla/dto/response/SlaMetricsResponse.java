package com.company.sla.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMetricsResponse {
    private String tenantId;
    private String period;
    private Instant periodStart;
    private String slaId;
    private String clientId;

    // 100 - (totalBreaches / activePolicies) * 10, floored at 0
    private BigDecimal complianceRate;
    private int totalBreaches;
    private int resolvedBreaches;
    // Minutes past deadline, averaged over resolved breaches
    private long averageResolutionTime;
    private Map<String, Long> breachesByType;
}
