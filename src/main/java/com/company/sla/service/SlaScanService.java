package com.company.sla.service;

import com.company.sla.cache.TenantScanLock;
import com.company.sla.dto.response.DetectedBreach;
import com.company.sla.dto.response.ScanResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * One scan pass for one tenant: detect, escalate each new breach once, then optionally
 * advance time-driven escalations and close breaches of finished tasks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaScanService {

    private final BreachDetectionService detectionService;
    private final EscalationService escalationService;
    private final BreachLifecycleService lifecycleService;
    private final TenantScanLock scanLock;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    @Value("${sla.scan.process-escalations:true}")
    private boolean processEscalations;

    @Value("${sla.scan.auto-resolve:true}")
    private boolean autoResolve;

    /**
     * Operator-triggered scan, run synchronously.
     */
    @CacheEvict(value = "slaMetrics", allEntries = true)
    public ScanResult runManualScan(String tenantId) {
        log.info("Manual SLA scan requested for tenant {}", tenantId);
        return scanTenant(tenantId);
    }

    @CacheEvict(value = "slaMetrics", allEntries = true)
    public ScanResult scanTenant(String tenantId) {
        String token = UUID.randomUUID().toString();
        if (!scanLock.tryAcquire(tenantId, token)) {
            return ScanResult.skipped(tenantId);
        }

        Span span = tracer.spanBuilder("sla.scan.tenant")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenant.id", tenantId);

            List<DetectedBreach> detected = detectionService.detectBreaches(tenantId);

            int escalations = 0;
            for (DetectedBreach detectedBreach : detected) {
                String breachId = detectedBreach.getBreach().getId();
                try {
                    if (escalationService.escalateBreach(breachId).isEscalated()) {
                        escalations++;
                    }
                } catch (Exception e) {
                    log.error("Failed to escalate breach {} of tenant {}", breachId, tenantId, e);
                }
            }

            if (processEscalations) {
                escalations += escalationService.processEscalations(tenantId);
            }

            int resolved = autoResolve ? lifecycleService.autoResolveCompletedTasks(tenantId) : 0;

            span.setAttribute("breaches.detected", detected.size());
            span.setAttribute("escalations.triggered", escalations);

            log.info("SLA scan for tenant {}: {} breaches detected, {} escalations, {} auto-resolved",
                    tenantId, detected.size(), escalations, resolved);

            return ScanResult.builder()
                    .tenantId(tenantId)
                    .breachesDetected(detected.size())
                    .escalationsTriggered(escalations)
                    .autoResolved(resolved)
                    .build();

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Scan failed");
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("sla.scan.duration"));
            span.end();
            scanLock.release(tenantId, token);
        }
    }
}
