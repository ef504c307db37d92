package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaBreachAction;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.dto.response.EscalationResult;
import com.company.sla.repository.SlaBreachActionRepository;
import com.company.sla.util.AttemptedEffect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the actions a policy configures for the moment a breach is created.
 * Only notify and escalate are executed; other action types are reported as skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachActionExecutor {

    private static final String ACTIONS_EFFECT = "breach_actions";

    private final SlaBreachActionRepository actionRepository;
    private final SlaNotificationService notificationService;
    private final EscalationService escalationService;
    private final MeterRegistry meterRegistry;

    public List<AttemptedEffect> executeOnBreach(SlaBreach breach, SlaPolicy policy) {
        List<AttemptedEffect> effects = new ArrayList<>();

        List<SlaBreachAction> actions;
        try {
            actions = actionRepository.findEnabled(breach.getSlaId(), SlaBreachAction.TRIGGER_BREACH);
        } catch (Exception e) {
            log.error("Failed to load breach actions for SLA {}", breach.getSlaId(), e);
            meterRegistry.counter("sla.effects.failed", "effect", ACTIONS_EFFECT).increment();
            effects.add(AttemptedEffect.failed(ACTIONS_EFFECT, e));
            return effects;
        }

        for (SlaBreachAction action : actions) {
            switch (action.getActionType()) {
                case NOTIFY:
                    effects.add(notificationService.notifyBreachDetected(breach, policy));
                    break;
                case ESCALATE:
                    effects.add(escalate(breach));
                    break;
                default:
                    log.debug("Breach action {} is not executed by the engine", action.getActionType().getValue());
                    effects.add(AttemptedEffect.skipped(action.getActionType().getValue(), "not supported"));
            }
        }
        return effects;
    }

    private AttemptedEffect escalate(SlaBreach breach) {
        try {
            EscalationResult result = escalationService.escalateBreach(breach.getId());
            return result.isEscalated()
                    ? AttemptedEffect.succeeded(AttemptedEffect.BREACH_ESCALATION)
                    : AttemptedEffect.skipped(AttemptedEffect.BREACH_ESCALATION, "no next escalation level");
        } catch (Exception e) {
            log.error("Escalate action failed for breach {}", breach.getId(), e);
            meterRegistry.counter("sla.effects.failed", "effect", AttemptedEffect.BREACH_ESCALATION).increment();
            return AttemptedEffect.failed(AttemptedEffect.BREACH_ESCALATION, e);
        }
    }
}
