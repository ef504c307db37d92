package com.company.sla.domain.enums;

import java.util.EnumSet;
import java.util.Set;

public enum BreachStatus {
    DETECTED("detected", "Breach detected by a scan"),
    ACKNOWLEDGED("acknowledged", "Breach acknowledged by a user"),
    ESCALATED("escalated", "Breach escalated to at least one chain level"),
    RESOLVED("resolved", "Breach resolved by a user"),
    AUTO_RESOLVED("auto_resolved", "Breach resolved because the work item was closed");

    public static final Set<BreachStatus> ACTIVE = EnumSet.of(DETECTED, ACKNOWLEDGED, ESCALATED);

    private final String value;
    private final String description;

    BreachStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == AUTO_RESOLVED;
    }

    public static BreachStatus fromValue(String value) {
        if (value == null) {
            return DETECTED;
        }
        for (BreachStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown breach status: " + value);
    }
}
