package com.company.sla.service;

import com.company.sla.domain.EscalationLevel;
import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.dto.response.EscalationResult;
import com.company.sla.repository.EscalationChainRepository;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.WorkItemStore;
import com.company.sla.util.AttemptedEffect;
import com.company.sla.util.DeadlineCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves active breaches up their policy's escalation chain, one level per step.
 * The level change is committed first; notification, reassignment and the audit
 * event follow as attempted effects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationService {

    private final SlaBreachRepository breachRepository;
    private final EscalationChainRepository chainRepository;
    private final ProfileDirectory profileDirectory;
    private final WorkItemStore workItemStore;
    private final SlaNotificationService notificationService;
    private final BreachAuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${sla.escalation.include-acknowledged:false}")
    private boolean includeAcknowledged;

    public EscalationResult escalateBreach(String breachId) {
        Optional<SlaBreach> breachOpt = breachRepository.findById(breachId);
        if (breachOpt.isEmpty()) {
            log.debug("Breach {} not found, nothing to escalate", breachId);
            return EscalationResult.notEscalated(0);
        }

        SlaBreach breach = breachOpt.get();
        int currentLevel = breach.escalationLevel();

        if (!breach.isActive()) {
            log.debug("Breach {} is {}, not escalating", breachId, breach.getStatus().getValue());
            return EscalationResult.notEscalated(currentLevel);
        }

        int nextLevel = currentLevel + 1;
        Optional<EscalationLevel> levelOpt = chainRepository.findLevel(breach.getSlaId(), nextLevel);
        if (levelOpt.isEmpty()) {
            log.debug("Breach {} is at the last escalation level ({})", breachId, currentLevel);
            return EscalationResult.notEscalated(currentLevel);
        }

        int updated = breachRepository.markEscalated(breachId, currentLevel, nextLevel);
        if (updated == 0) {
            // Another pass escalated or closed the breach since it was read
            log.debug("Breach {} changed concurrently, skipping escalation to level {}", breachId, nextLevel);
            return EscalationResult.notEscalated(currentLevel);
        }

        breach.setStatus(BreachStatus.ESCALATED);
        breach.setCurrentEscalationLevel(nextLevel);

        meterRegistry.counter("sla.escalations", "level", String.valueOf(nextLevel)).increment();
        log.warn("Breach {} escalated from level {} to {}", breachId, currentLevel, nextLevel);

        EscalationLevel level = levelOpt.get();
        List<String> actions = new ArrayList<>();
        List<AttemptedEffect> effects = new ArrayList<>();
        String escalatedTo = null;

        if (level.getProfileId() != null) {
            escalatedTo = lookupProfileName(level.getProfileId(), effects);

            if (escalatedTo != null) {
                if (!Boolean.FALSE.equals(level.getNotifyInApp())) {
                    addEffect(notificationService.notifyEscalation(breach, level.getProfileId(), nextLevel),
                            actions, effects);
                }
                if (Boolean.TRUE.equals(level.getReassignTask())
                        && WorkItem.RESOURCE_TYPE_TASK.equals(breach.getResourceType())) {
                    addEffect(reassign(breach, level.getProfileId()), actions, effects);
                }
            }
        }

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("fromLevel", currentLevel);
        eventData.put("toLevel", nextLevel);
        eventData.put("escalatedTo", escalatedTo);
        eventData.put("actions", new ArrayList<>(actions));
        effects.add(auditService.recordSystemEvent(breachId, BreachEventType.ESCALATED, eventData));

        return EscalationResult.builder()
                .escalated(true)
                .newLevel(nextLevel)
                .escalatedTo(escalatedTo)
                .actions(actions)
                .effects(effects)
                .build();
    }

    /**
     * Escalates every active breach of the tenant whose next level's threshold, counted in whole
     * minutes since detection, has been reached. A breach moves at most one level per call.
     *
     * @return number of breaches escalated
     */
    public int processEscalations(String tenantId) {
        Instant now = clock.instant();
        Set<BreachStatus> statuses = EnumSet.of(BreachStatus.DETECTED, BreachStatus.ESCALATED);
        if (includeAcknowledged) {
            statuses.add(BreachStatus.ACKNOWLEDGED);
        }

        List<SlaBreach> breaches = breachRepository.findByTenantAndStatuses(tenantId, statuses);
        int escalatedCount = 0;

        for (SlaBreach breach : breaches) {
            try {
                Optional<EscalationLevel> next = chainRepository.findLevel(
                        breach.getSlaId(), breach.escalationLevel() + 1);
                if (next.isEmpty()) {
                    continue;
                }

                long minutesSinceBreach = DeadlineCalculator.minutesBetween(breach.getDetectedAt(), now);
                if (minutesSinceBreach >= next.get().getEscalateAfterMinutes()
                        && escalateBreach(breach.getId()).isEscalated()) {
                    escalatedCount++;
                }
            } catch (Exception e) {
                log.error("Failed to process escalation for breach {} of tenant {}", breach.getId(), tenantId, e);
            }
        }

        if (escalatedCount > 0) {
            log.info("Escalated {} of {} active breaches for tenant {}", escalatedCount, breaches.size(), tenantId);
        }
        return escalatedCount;
    }

    private String lookupProfileName(String profileId, List<AttemptedEffect> effects) {
        try {
            Optional<String> name = profileDirectory.findDisplayName(profileId);
            if (name.isEmpty()) {
                log.warn("Escalation profile {} not found, skipping notification and reassignment", profileId);
                effects.add(AttemptedEffect.skipped(AttemptedEffect.IN_APP_NOTIFICATION,
                        "profile " + profileId + " not found"));
            }
            return name.orElse(null);
        } catch (Exception e) {
            log.warn("Failed to look up escalation profile {}: {}", profileId, e.getMessage());
            meterRegistry.counter("sla.effects.failed", "effect", "profile_lookup").increment();
            effects.add(AttemptedEffect.failed("profile_lookup", e));
            return null;
        }
    }

    private AttemptedEffect reassign(SlaBreach breach, String profileId) {
        try {
            workItemStore.addAssignment(breach.getResourceId(), profileId);
            log.info("Task {} reassigned to {} after escalation of breach {}",
                    breach.getResourceId(), profileId, breach.getId());
            return AttemptedEffect.succeeded(AttemptedEffect.TASK_REASSIGNED);
        } catch (Exception e) {
            log.warn("Failed to reassign task {} to {}: {}", breach.getResourceId(), profileId, e.getMessage());
            meterRegistry.counter("sla.effects.failed", "effect", AttemptedEffect.TASK_REASSIGNED).increment();
            return AttemptedEffect.failed(AttemptedEffect.TASK_REASSIGNED, e);
        }
    }

    private void addEffect(AttemptedEffect effect, List<String> actions, List<AttemptedEffect> effects) {
        effects.add(effect);
        if (effect.isSucceeded()) {
            actions.add(effect.getEffect());
        }
    }
}
