package com.company.sla.scheduled;

import com.company.sla.dto.response.ScanResult;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.service.SlaScanService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * PERIODIC SLA SCAN (every 5 minutes by default)
 * Scans every tenant that has at least one profile. A failing tenant is logged and
 * counted; the remaining tenants are still scanned.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "sla.scan.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SlaScanJob {

    private final ProfileDirectory profileDirectory;
    private final SlaScanService scanService;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${sla.scan.cron:0 */5 * * * *}")
    public void scanAllTenants() {
        Instant startTime = Instant.now();

        List<String> tenantIds;
        try {
            tenantIds = profileDirectory.findTenantIds();
        } catch (Exception e) {
            log.error("SLA scan aborted: could not list tenants", e);
            meterRegistry.counter("sla.scan.failures").increment();
            return;
        }

        int breaches = 0;
        int escalations = 0;
        int failures = 0;

        for (String tenantId : tenantIds) {
            MDC.put("tenantId", tenantId);
            try {
                ScanResult result = scanService.scanTenant(tenantId);
                breaches += result.getBreachesDetected();
                escalations += result.getEscalationsTriggered();
            } catch (Exception e) {
                failures++;
                log.error("SLA scan failed for tenant {}", tenantId, e);
                meterRegistry.counter("sla.scan.tenant_failures").increment();
            } finally {
                MDC.remove("tenantId");
            }
        }

        log.info("SLA scan completed: {} tenants, {} breaches detected, {} escalations, {} failed tenants in {}ms",
                tenantIds.size(), breaches, escalations, failures,
                Duration.between(startTime, Instant.now()).toMillis());
    }
}
