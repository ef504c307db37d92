package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import com.company.sla.domain.enums.WorkItemStatus;
import com.company.sla.dto.response.DetectedBreach;
import com.company.sla.dto.response.SlaCheckResult;
import com.company.sla.exception.InvalidPolicyException;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.SlaPolicyRepository;
import com.company.sla.repository.WorkItemStore;
import com.company.sla.util.AttemptedEffect;
import com.company.sla.util.DeadlineCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds open tasks that are past their response or resolution deadline and records one breach
 * per (policy, task). The breach row is the primary write; its audit event and the policy's
 * on-breach actions are attempted afterwards and never undo it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachDetectionService {

    private final SlaPolicyRepository policyRepository;
    private final SlaBreachRepository breachRepository;
    private final WorkItemStore workItemStore;
    private final SlaPolicyResolver policyResolver;
    private final BreachAuditService auditService;
    private final BreachActionExecutor actionExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public List<DetectedBreach> detectBreaches(String tenantId) {
        List<SlaPolicy> policies = policyRepository.findActiveByTenant(tenantId);
        if (policies.isEmpty()) {
            log.debug("Tenant {} has no active SLA policies", tenantId);
            return List.of();
        }

        Instant now = clock.instant();
        List<DetectedBreach> detected = new ArrayList<>();

        for (SlaPolicy policy : policies) {
            if (!policy.appliesToResource(WorkItem.RESOURCE_TYPE_TASK)) {
                continue;
            }

            try {
                detectForPolicy(tenantId, policy, policies, now, detected);
            } catch (InvalidPolicyException e) {
                log.error("Skipping SLA policy {} of tenant {}: {}", policy.getId(), tenantId, e.getMessage());
            }
        }

        if (!detected.isEmpty()) {
            log.info("Detected {} new SLA breaches for tenant {}", detected.size(), tenantId);
        }
        return detected;
    }

    private void detectForPolicy(String tenantId, SlaPolicy policy, List<SlaPolicy> activePolicies,
                                 Instant now, List<DetectedBreach> detected) {
        List<WorkItem> tasks = workItemStore.findOpenTasks(tenantId, policy.getProjectId());

        for (WorkItem task : tasks) {
            // A task is governed by exactly one policy; other matching policies must not breach it
            Optional<SlaPolicy> governing = policyResolver.findApplicablePolicy(activePolicies,
                    task.getClientId(), task.getProjectId(), WorkItem.RESOURCE_TYPE_TASK, task.getPriority());
            if (governing.isEmpty() || !policy.getId().equals(governing.get().getId())) {
                continue;
            }

            if (breachRepository.existsActiveBreach(policy.getId(), task.getId())) {
                continue;
            }

            boolean hasResponse = hasResponse(task);
            BreachType breachType = null;
            Instant deadline;

            if (!hasResponse) {
                deadline = DeadlineCalculator.calculateDeadline(
                        task.getCreatedAt(), policy.getResponseTimeHours(), policy);
                if (now.isAfter(deadline)) {
                    breachType = BreachType.RESPONSE_TIME;
                }
            } else {
                deadline = DeadlineCalculator.calculateDeadline(
                        task.getCreatedAt(), policy.getResolutionTimeHours(), policy);
                if (now.isAfter(deadline)) {
                    breachType = BreachType.RESOLUTION_TIME;
                }
            }

            if (breachType != null) {
                createBreach(tenantId, policy, task.getId(), breachType, deadline, now)
                        .ifPresent(detected::add);
            }
        }
    }

    /**
     * Current SLA status of a task under the policy that governs it.
     *
     * @return empty when the task does not exist in the tenant or no policy applies
     */
    public Optional<SlaCheckResult> checkSlaForTask(String taskId, String tenantId, String clientId,
                                                    String projectId) {
        Optional<WorkItem> taskOpt = workItemStore.findById(taskId);
        if (taskOpt.isEmpty()) {
            return Optional.empty();
        }

        WorkItem task = taskOpt.get();
        if (task.getTenantId() != null && !task.getTenantId().equals(tenantId)) {
            log.debug("Task {} does not belong to tenant {}", taskId, tenantId);
            return Optional.empty();
        }

        Optional<SlaPolicy> policyOpt = policyResolver.findApplicablePolicy(
                tenantId, clientId, projectId, WorkItem.RESOURCE_TYPE_TASK, task.getPriority());
        if (policyOpt.isEmpty()) {
            return Optional.empty();
        }

        SlaPolicy policy = policyOpt.get();
        Instant now = clock.instant();
        Instant createdAt = task.getCreatedAt();

        Instant responseDeadline = DeadlineCalculator.calculateDeadline(
                createdAt, policy.getResponseTimeHours(), policy);
        Instant resolutionDeadline = DeadlineCalculator.calculateDeadline(
                createdAt, policy.getResolutionTimeHours(), policy);

        boolean hasResponse = hasResponse(task);
        boolean resolved = task.getStatus() != null && task.getStatus().isTerminal();

        BreachType breachType = null;
        Instant deadlineAt = null;
        if (!hasResponse && now.isAfter(responseDeadline)) {
            breachType = BreachType.RESPONSE_TIME;
            deadlineAt = responseDeadline;
        } else if (!resolved && now.isAfter(resolutionDeadline)) {
            breachType = BreachType.RESOLUTION_TIME;
            deadlineAt = resolutionDeadline;
        }

        Instant target = hasResponse ? resolutionDeadline : responseDeadline;

        return Optional.of(SlaCheckResult.builder()
                .slaId(policy.getId())
                .breached(breachType != null)
                .breachType(breachType)
                .deadlineAt(deadlineAt)
                .elapsedMinutes(DeadlineCalculator.minutesBetween(createdAt, now))
                .remainingMinutes(DeadlineCalculator.minutesBetween(now, target))
                .build());
    }

    private boolean hasResponse(WorkItem task) {
        return task.getStatus() != WorkItemStatus.PENDING || workItemStore.hasAssignment(task.getId());
    }

    private Optional<DetectedBreach> createBreach(String tenantId, SlaPolicy policy, String taskId,
                                                  BreachType breachType, Instant deadline, Instant now) {
        SlaBreach breach = SlaBreach.builder()
                .tenantId(tenantId)
                .slaId(policy.getId())
                .resourceType(WorkItem.RESOURCE_TYPE_TASK)
                .resourceId(taskId)
                .breachType(breachType)
                .status(BreachStatus.DETECTED)
                .currentEscalationLevel(0)
                .detectedAt(now)
                .deadlineAt(deadline)
                .build();

        try {
            breachRepository.insert(breach);
        } catch (DuplicateKeyException e) {
            log.warn("Active breach already recorded for SLA {} and task {}, skipping", policy.getId(), taskId);
            meterRegistry.counter("sla.breaches.duplicate", "breach_type", breachType.getValue()).increment();
            return Optional.empty();
        }

        meterRegistry.counter("sla.breaches.detected", "breach_type", breachType.getValue()).increment();
        log.warn("SLA breach {} detected: {} for task {} under SLA {} (deadline {})",
                breach.getId(), breachType.getValue(), taskId, policy.getId(), deadline);

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("slaId", policy.getId());
        eventData.put("resourceType", breach.getResourceType());
        eventData.put("resourceId", taskId);
        eventData.put("breachType", breachType.getValue());
        eventData.put("deadlineAt", deadline.toString());

        List<AttemptedEffect> effects = new ArrayList<>();
        effects.add(auditService.recordSystemEvent(breach.getId(), BreachEventType.DETECTED, eventData));
        effects.addAll(actionExecutor.executeOnBreach(breach, policy));

        return Optional.of(new DetectedBreach(breach, effects));
    }
}
