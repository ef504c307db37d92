package com.company.sla.util;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of one best-effort side effect (notification, reassignment, audit write)
 * performed after a committed state change.
 */
@Data
@AllArgsConstructor
public class AttemptedEffect {
    public static final String AUDIT_EVENT = "audit_event";
    public static final String IN_APP_NOTIFICATION = "in_app_notification";
    public static final String TASK_REASSIGNED = "task_reassigned";
    public static final String BREACH_NOTIFICATION = "breach_notification";
    public static final String BREACH_ESCALATION = "breach_escalation";

    private String effect;
    private boolean succeeded;
    private String error;

    public static AttemptedEffect succeeded(String effect) {
        return new AttemptedEffect(effect, true, null);
    }

    public static AttemptedEffect failed(String effect, Exception cause) {
        return new AttemptedEffect(effect, false, cause.getMessage());
    }

    public static AttemptedEffect skipped(String effect, String reason) {
        return new AttemptedEffect(effect, false, reason);
    }
}
