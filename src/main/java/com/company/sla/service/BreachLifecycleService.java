package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.TriggeredBy;
import com.company.sla.exception.TenantAccessDeniedException;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.WorkItemStore;
import com.company.sla.util.DeadlineCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class BreachLifecycleService {

    private final SlaBreachRepository breachRepository;
    private final WorkItemStore workItemStore;
    private final BreachAuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @return false when the breach does not exist or is already resolved
     * @throws TenantAccessDeniedException when the breach belongs to another tenant
     */
    @CacheEvict(value = "slaMetrics", allEntries = true)
    public boolean acknowledgeBreach(String breachId, String userId, String tenantId, String notes) {
        Optional<SlaBreach> breachOpt = loadForTenant(breachId, tenantId);
        if (breachOpt.isEmpty() || !breachOpt.get().isActive()) {
            return false;
        }

        Instant now = clock.instant();
        int updated = breachRepository.acknowledge(breachId, tenantId, now, userId, notes);
        if (updated == 0) {
            log.debug("Breach {} was closed before it could be acknowledged", breachId);
            return false;
        }

        log.info("Breach {} acknowledged by {}", breachId, userId);

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("acknowledgedBy", userId);
        eventData.put("notes", notes);
        auditService.record(breachId, BreachEventType.ACKNOWLEDGED, eventData, TriggeredBy.USER, userId);

        return true;
    }

    /**
     * Closes the breach. The recorded duration is the whole minutes spent past the deadline.
     *
     * @return false when the breach does not exist or is already resolved
     * @throws TenantAccessDeniedException when the breach belongs to another tenant
     */
    @CacheEvict(value = "slaMetrics", allEntries = true)
    public boolean resolveBreach(String breachId, String userId, String tenantId, boolean autoResolved) {
        Optional<SlaBreach> breachOpt = loadForTenant(breachId, tenantId);
        if (breachOpt.isEmpty() || !breachOpt.get().isActive()) {
            return false;
        }

        SlaBreach breach = breachOpt.get();
        Instant now = clock.instant();
        int durationMinutes = Math.toIntExact(DeadlineCalculator.minutesBetween(breach.getDeadlineAt(), now));
        BreachStatus status = autoResolved ? BreachStatus.AUTO_RESOLVED : BreachStatus.RESOLVED;

        int updated = breachRepository.resolve(breachId, tenantId, status, now, userId, durationMinutes);
        if (updated == 0) {
            log.debug("Breach {} was already closed", breachId);
            return false;
        }

        meterRegistry.counter("sla.breaches.resolved", "status", status.getValue()).increment();
        log.info("Breach {} {} by {} after {} minutes past deadline",
                breachId, status.getValue(), userId, durationMinutes);

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("resolvedBy", userId);
        eventData.put("autoResolved", autoResolved);
        eventData.put("breachDurationMinutes", durationMinutes);
        auditService.record(breachId, BreachEventType.RESOLVED, eventData,
                autoResolved ? TriggeredBy.SYSTEM : TriggeredBy.USER, userId);

        return true;
    }

    /**
     * Resolves active task breaches whose task has been completed or cancelled in the meantime.
     * The acknowledging user, or the tenant itself, is recorded as the resolver.
     *
     * @return number of breaches resolved
     */
    public int autoResolveCompletedTasks(String tenantId) {
        List<SlaBreach> breaches = breachRepository.findActiveByTenantAndResourceType(
                tenantId, WorkItem.RESOURCE_TYPE_TASK);
        int resolvedCount = 0;

        for (SlaBreach breach : breaches) {
            try {
                Optional<WorkItem> task = workItemStore.findById(breach.getResourceId());
                if (task.isEmpty() || task.get().getStatus() == null || !task.get().getStatus().isTerminal()) {
                    continue;
                }

                String actor = breach.getAcknowledgedBy() != null ? breach.getAcknowledgedBy() : tenantId;
                if (resolveBreach(breach.getId(), actor, tenantId, true)) {
                    resolvedCount++;
                }
            } catch (Exception e) {
                log.error("Failed to auto-resolve breach {} of tenant {}", breach.getId(), tenantId, e);
            }
        }

        if (resolvedCount > 0) {
            log.info("Auto-resolved {} breaches for tenant {}", resolvedCount, tenantId);
        }
        return resolvedCount;
    }

    private Optional<SlaBreach> loadForTenant(String breachId, String tenantId) {
        Optional<SlaBreach> breachOpt = breachRepository.findById(breachId);
        if (breachOpt.isPresent() && !tenantId.equals(breachOpt.get().getTenantId())) {
            log.warn("Tenant {} attempted to modify breach {} of another tenant", tenantId, breachId);
            throw new TenantAccessDeniedException(tenantId, breachId);
        }
        return breachOpt;
    }
}
