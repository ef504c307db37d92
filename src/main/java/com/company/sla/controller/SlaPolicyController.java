package com.company.sla.controller;

import com.company.sla.domain.EscalationLevel;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.dto.request.CreateEscalationLevelRequest;
import com.company.sla.dto.request.CreateSlaPolicyRequest;
import com.company.sla.dto.request.UpdatePolicyStatusRequest;
import com.company.sla.security.TenantContext;
import com.company.sla.service.SlaPolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sla/definitions")
@Tag(name = "SLA Definitions", description = "Manage SLA definitions and escalation chains")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SlaPolicyController {

    private final SlaPolicyService policyService;
    private final TenantContext tenantContext;

    @GetMapping
    @Operation(summary = "List SLA definitions of the caller's tenant")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<List<SlaPolicy>> list() {
        return ResponseEntity.ok(policyService.listPolicies(tenantContext.getCurrentTenantId()));
    }

    @PostMapping
    @Operation(summary = "Create an SLA definition")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<SlaPolicy> create(@Valid @RequestBody CreateSlaPolicyRequest request) {
        SlaPolicy policy = policyService.createPolicy(
                tenantContext.getCurrentTenantId(), tenantContext.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(policy);
    }

    @GetMapping("/{slaId}")
    @Operation(summary = "Get an SLA definition")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<SlaPolicy> get(@PathVariable String slaId) {
        return ResponseEntity.ok(policyService.getPolicy(tenantContext.getCurrentTenantId(), slaId));
    }

    @PutMapping("/{slaId}")
    @Operation(summary = "Replace an SLA definition", description = "Rejected with 409 once a breach references it")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<SlaPolicy> update(@PathVariable String slaId,
                                            @Valid @RequestBody CreateSlaPolicyRequest request) {
        return ResponseEntity.ok(policyService.updatePolicy(tenantContext.getCurrentTenantId(), slaId, request));
    }

    @PatchMapping("/{slaId}/status")
    @Operation(summary = "Activate, pause or archive an SLA definition")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<SlaPolicy> updateStatus(@PathVariable String slaId,
                                                  @Valid @RequestBody UpdatePolicyStatusRequest request) {
        return ResponseEntity.ok(policyService.updateStatus(
                tenantContext.getCurrentTenantId(), slaId, request.getStatus()));
    }

    @DeleteMapping("/{slaId}")
    @Operation(summary = "Delete an SLA definition", description = "Rejected with 409 once a breach references it")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<Void> delete(@PathVariable String slaId) {
        policyService.deletePolicy(tenantContext.getCurrentTenantId(), slaId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{slaId}/escalations")
    @Operation(summary = "Escalation chain of an SLA definition, ordered by level")
    @PreAuthorize("hasAnyRole('SLA_READER', 'SLA_ADMIN')")
    public ResponseEntity<List<EscalationLevel>> getEscalations(@PathVariable String slaId) {
        return ResponseEntity.ok(policyService.getEscalationChain(tenantContext.getCurrentTenantId(), slaId));
    }

    @PostMapping("/{slaId}/escalations")
    @Operation(summary = "Append the next escalation level")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<EscalationLevel> addEscalation(@PathVariable String slaId,
                                                         @Valid @RequestBody CreateEscalationLevelRequest request) {
        EscalationLevel level = policyService.addEscalationLevel(tenantContext.getCurrentTenantId(), slaId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(level);
    }
}
