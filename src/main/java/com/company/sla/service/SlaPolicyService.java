package com.company.sla.service;

import com.company.sla.domain.EscalationLevel;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.domain.enums.PolicyStatus;
import com.company.sla.dto.request.CreateEscalationLevelRequest;
import com.company.sla.dto.request.CreateSlaPolicyRequest;
import com.company.sla.exception.InvalidPolicyException;
import com.company.sla.exception.PolicyInUseException;
import com.company.sla.exception.PolicyNotFoundException;
import com.company.sla.repository.EscalationChainRepository;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.SlaPolicyRepository;
import com.company.sla.util.DeadlineCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Administration of SLA definitions and their escalation chains.
 * A definition referenced by any breach can no longer be edited or deleted, only paused or archived.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaPolicyService {

    private final SlaPolicyRepository policyRepository;
    private final EscalationChainRepository chainRepository;
    private final SlaBreachRepository breachRepository;
    private final ProfileDirectory profileDirectory;

    public List<SlaPolicy> listPolicies(String tenantId) {
        return policyRepository.findByTenant(tenantId);
    }

    public SlaPolicy getPolicy(String tenantId, String slaId) {
        return policyRepository.findByIdAndTenant(slaId, tenantId)
                .orElseThrow(() -> new PolicyNotFoundException(slaId));
    }

    @CacheEvict(value = "slaMetrics", allEntries = true)
    public SlaPolicy createPolicy(String tenantId, String userId, CreateSlaPolicyRequest request) {
        SlaPolicy policy = toPolicy(request);
        policy.setTenantId(tenantId);
        policy.setCreatedBy(userId);
        policy.setStatus(PolicyStatus.ACTIVE);

        DeadlineCalculator.validate(policy);
        return policyRepository.insert(policy);
    }

    @CacheEvict(value = "slaMetrics", allEntries = true)
    public SlaPolicy updatePolicy(String tenantId, String slaId, CreateSlaPolicyRequest request) {
        SlaPolicy existing = getPolicy(tenantId, slaId);
        if (breachRepository.existsBySlaId(slaId)) {
            throw new PolicyInUseException(slaId);
        }

        SlaPolicy updated = toPolicy(request);
        updated.setId(existing.getId());
        updated.setTenantId(tenantId);
        updated.setCreatedBy(existing.getCreatedBy());
        updated.setCreatedAt(existing.getCreatedAt());
        updated.setStatus(existing.getStatus());

        DeadlineCalculator.validate(updated);
        policyRepository.update(updated);
        log.info("Updated SLA definition {} for tenant {}", slaId, tenantId);
        return updated;
    }

    @CacheEvict(value = "slaMetrics", allEntries = true)
    public SlaPolicy updateStatus(String tenantId, String slaId, String status) {
        SlaPolicy policy = getPolicy(tenantId, slaId);
        PolicyStatus newStatus;
        try {
            newStatus = PolicyStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyException("Unknown SLA status: " + status);
        }

        policyRepository.updateStatus(slaId, tenantId, newStatus);
        log.info("SLA definition {} status changed from {} to {}",
                slaId, policy.getStatus().getValue(), newStatus.getValue());
        policy.setStatus(newStatus);
        return policy;
    }

    @CacheEvict(value = "slaMetrics", allEntries = true)
    public void deletePolicy(String tenantId, String slaId) {
        getPolicy(tenantId, slaId);
        if (breachRepository.existsBySlaId(slaId)) {
            throw new PolicyInUseException(slaId);
        }
        policyRepository.delete(slaId, tenantId);
        log.info("Deleted SLA definition {} for tenant {}", slaId, tenantId);
    }

    public List<EscalationLevel> getEscalationChain(String tenantId, String slaId) {
        getPolicy(tenantId, slaId);
        return chainRepository.findBySlaId(slaId);
    }

    /**
     * Appends a level after the current last one, keeping levels dense from 1.
     */
    public EscalationLevel addEscalationLevel(String tenantId, String slaId, CreateEscalationLevelRequest request) {
        getPolicy(tenantId, slaId);
        if (!profileDirectory.exists(request.getProfileId())) {
            throw new InvalidPolicyException("Profile not found: " + request.getProfileId());
        }

        EscalationLevel level = EscalationLevel.builder()
                .tenantId(tenantId)
                .slaId(slaId)
                .level(chainRepository.findMaxLevel(slaId) + 1)
                .escalateAfterMinutes(request.getEscalateAfterMinutes())
                .profileId(request.getProfileId())
                .notifyInApp(request.getNotifyInApp() != null ? request.getNotifyInApp() : Boolean.TRUE)
                .reassignTask(request.getReassignTask() != null ? request.getReassignTask() : Boolean.FALSE)
                .build();

        EscalationLevel saved = chainRepository.insert(level);
        log.info("Added escalation level {} to SLA definition {}", saved.getLevel(), slaId);
        return saved;
    }

    private SlaPolicy toPolicy(CreateSlaPolicyRequest request) {
        return SlaPolicy.builder()
                .name(request.getName())
                .description(request.getDescription())
                .clientId(request.getClientId())
                .projectId(request.getProjectId())
                .responseTimeHours(request.getResponseTimeHours())
                .resolutionTimeHours(request.getResolutionTimeHours())
                .appliesTo(request.getAppliesTo())
                .taskPriorities(request.getTaskPriorities())
                .businessHoursOnly(request.getBusinessHoursOnly() != null ? request.getBusinessHoursOnly() : Boolean.TRUE)
                .businessHoursStart(request.getBusinessHoursStart())
                .businessHoursEnd(request.getBusinessHoursEnd())
                .businessDays(request.getBusinessDays() != null
                        ? SlaPolicyRepository.parseDays(request.getBusinessDays().toArray(new String[0]))
                        : null)
                .timezone(request.getTimezone())
                .build();
    }
}
