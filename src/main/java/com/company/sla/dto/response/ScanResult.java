package com.company.sla.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {
    private String tenantId;
    private int breachesDetected;
    private int escalationsTriggered;
    private int autoResolved;
    // True when another scan held the tenant lock
    private boolean skipped;

    public static ScanResult skipped(String tenantId) {
        return ScanResult.builder().tenantId(tenantId).skipped(true).build();
    }
}
