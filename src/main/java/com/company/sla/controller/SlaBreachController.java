package com.company.sla.controller;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.MetricsPeriod;
import com.company.sla.dto.request.AcknowledgeBreachRequest;
import com.company.sla.dto.request.BreachHistoryFilter;
import com.company.sla.dto.response.BreachDetailResponse;
import com.company.sla.dto.response.EscalationResult;
import com.company.sla.dto.response.LifecycleResponse;
import com.company.sla.dto.response.ScanResult;
import com.company.sla.dto.response.SlaCheckResult;
import com.company.sla.dto.response.SlaMetricsResponse;
import com.company.sla.security.TenantContext;
import com.company.sla.service.BreachDetectionService;
import com.company.sla.service.BreachLifecycleService;
import com.company.sla.service.BreachQueryService;
import com.company.sla.service.EscalationService;
import com.company.sla.service.SlaMetricsService;
import com.company.sla.service.SlaScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sla")
@Tag(name = "SLA Breaches", description = "Breach history, lifecycle, escalation and metrics")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class SlaBreachController {

    private final BreachQueryService queryService;
    private final BreachLifecycleService lifecycleService;
    private final EscalationService escalationService;
    private final BreachDetectionService detectionService;
    private final SlaMetricsService metricsService;
    private final SlaScanService scanService;
    private final TenantContext tenantContext;

    @GetMapping("/breaches")
    @Operation(summary = "Breach history", description = "Most recent first, filtered by policy, client, status and detection time")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<List<SlaBreach>> getBreachHistory(
            @RequestParam(required = false) String slaId,
            @RequestParam(required = false) String clientId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) @Min(1) @Max(1000) Integer limit) {

        BreachHistoryFilter filter = BreachHistoryFilter.builder()
                .slaId(slaId)
                .clientId(clientId)
                .status(status != null ? BreachStatus.fromValue(status) : null)
                .startDate(startDate)
                .endDate(endDate)
                .limit(limit)
                .build();

        return ResponseEntity.ok(queryService.getBreachHistory(tenantContext.getCurrentTenantId(), filter));
    }

    @GetMapping("/breaches/{breachId}")
    @Operation(summary = "Breach detail with its event log")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<BreachDetailResponse> getBreach(@PathVariable String breachId) {
        return ResponseEntity.ok(queryService.getBreachDetail(tenantContext.getCurrentTenantId(), breachId));
    }

    @PostMapping("/breaches/{breachId}/acknowledge")
    @Operation(summary = "Acknowledge a breach", description = "success=false when the breach is missing or already resolved")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<LifecycleResponse> acknowledge(
            @PathVariable String breachId,
            @RequestBody(required = false) @Valid AcknowledgeBreachRequest request) {

        boolean success = lifecycleService.acknowledgeBreach(
                breachId,
                tenantContext.getCurrentUserId(),
                tenantContext.getCurrentTenantId(),
                request != null ? request.getNotes() : null);

        return ResponseEntity.ok(new LifecycleResponse(breachId, success));
    }

    @PostMapping("/breaches/{breachId}/resolve")
    @Operation(summary = "Resolve a breach", description = "success=false when the breach is missing or already resolved")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<LifecycleResponse> resolve(@PathVariable String breachId) {
        boolean success = lifecycleService.resolveBreach(
                breachId,
                tenantContext.getCurrentUserId(),
                tenantContext.getCurrentTenantId(),
                false);

        return ResponseEntity.ok(new LifecycleResponse(breachId, success));
    }

    @PostMapping("/breaches/{breachId}/escalate")
    @Operation(summary = "Escalate a breach one level now")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<EscalationResult> escalate(@PathVariable String breachId) {
        // Verifies the breach exists and belongs to the caller's tenant
        queryService.getBreachDetail(tenantContext.getCurrentTenantId(), breachId);
        return ResponseEntity.ok(escalationService.escalateBreach(breachId));
    }

    @PostMapping("/escalations/process")
    @Operation(summary = "Escalate every breach whose next threshold has been reached")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<Map<String, Object>> processEscalations() {
        int escalated = escalationService.processEscalations(tenantContext.getCurrentTenantId());
        return ResponseEntity.ok(Map.of("escalated", escalated));
    }

    @PostMapping("/breaches/auto-resolve")
    @Operation(summary = "Resolve breaches whose tasks are completed or cancelled")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<Map<String, Object>> autoResolve() {
        int resolved = lifecycleService.autoResolveCompletedTasks(tenantContext.getCurrentTenantId());
        return ResponseEntity.ok(Map.of("resolved", resolved));
    }

    @PostMapping("/scan")
    @Operation(summary = "Run a detection and escalation scan for the caller's tenant")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<ScanResult> runScan() {
        return ResponseEntity.ok(scanService.runManualScan(tenantContext.getCurrentTenantId()));
    }

    @GetMapping("/check/{resourceType}/{resourceId}")
    @Operation(summary = "Current SLA status of a task", description = "Only the task resource type is supported")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<SlaCheckResult> checkSla(
            @PathVariable String resourceType,
            @PathVariable String resourceId,
            @RequestParam String clientId,
            @RequestParam(required = false) String projectId) {

        if (!"task".equals(resourceType)) {
            throw new IllegalArgumentException("Only task SLA checks are currently supported");
        }

        return detectionService.checkSlaForTask(resourceId, tenantContext.getCurrentTenantId(), clientId, projectId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/metrics")
    @Operation(summary = "Compliance metrics for the current day, week or month",
            description = "Cached per tenant for up to one minute; scans, policy edits, acknowledgements "
                    + "and resolutions clear the cache.")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<SlaMetricsResponse> getMetrics(
            @Parameter(description = "daily, weekly or monthly")
            @RequestParam(defaultValue = "monthly") String period,
            @RequestParam(required = false) String slaId,
            @RequestParam(required = false) String clientId) {

        return ResponseEntity.ok(metricsService.getSlaMetrics(
                tenantContext.getCurrentTenantId(), MetricsPeriod.fromString(period), slaId, clientId));
    }
}
