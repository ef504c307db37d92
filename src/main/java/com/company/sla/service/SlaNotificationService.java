package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.util.AttemptedEffect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the breach and escalation notifications and hands them to the {@link NotificationSink}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaNotificationService {

    public static final String TYPE_ESCALATION = "sla_escalation";
    public static final String TYPE_BREACH = "sla_breach";

    private final NotificationSink notificationSink;
    private final ProfileDirectory profileDirectory;
    private final MeterRegistry meterRegistry;

    public AttemptedEffect notifyEscalation(SlaBreach breach, String profileId, int level) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("breachId", breach.getId());
        metadata.put("slaId", breach.getSlaId());
        metadata.put("resourceType", breach.getResourceType());
        metadata.put("resourceId", breach.getResourceId());
        metadata.put("level", level);

        String message = String.format("A %s breach has been escalated to you (Level %d)",
                breach.getBreachType().getLabel(), level);

        return deliver(AttemptedEffect.IN_APP_NOTIFICATION, profileId, TYPE_ESCALATION,
                "SLA Breach Escalated", message, metadata);
    }

    /**
     * Tells the policy's creator that a breach was detected. Skipped when the policy has no creator
     * or the creator's profile no longer exists.
     */
    public AttemptedEffect notifyBreachDetected(SlaBreach breach, SlaPolicy policy) {
        String recipient = policy.getCreatedBy();
        if (recipient == null) {
            return AttemptedEffect.skipped(AttemptedEffect.BREACH_NOTIFICATION, "policy has no creator");
        }
        if (!profileDirectory.exists(recipient)) {
            return AttemptedEffect.skipped(AttemptedEffect.BREACH_NOTIFICATION, "profile " + recipient + " not found");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("breachId", breach.getId());
        metadata.put("slaId", breach.getSlaId());
        metadata.put("slaName", policy.getName());
        metadata.put("resourceType", breach.getResourceType());
        metadata.put("resourceId", breach.getResourceId());
        metadata.put("breachType", breach.getBreachType().getValue());

        String message = String.format("A %s breach was detected for %s %s",
                breach.getBreachType().getLabel(), breach.getResourceType(), breach.getResourceId());

        return deliver(AttemptedEffect.BREACH_NOTIFICATION, recipient, TYPE_BREACH,
                "SLA Breach Detected", message, metadata);
    }

    private AttemptedEffect deliver(String effect, String profileId, String type, String title, String message,
                                    Map<String, Object> metadata) {
        try {
            notificationSink.createNotification(profileId, type, title, message, metadata);
            return AttemptedEffect.succeeded(effect);
        } catch (Exception e) {
            log.warn("Failed to notify profile {} about breach {}: {}",
                    profileId, metadata.get("breachId"), e.getMessage());
            meterRegistry.counter("sla.effects.failed", "effect", effect).increment();
            return AttemptedEffect.failed(effect, e);
        }
    }
}
