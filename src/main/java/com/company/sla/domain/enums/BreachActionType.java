package com.company.sla.domain.enums;

public enum BreachActionType {
    NOTIFY("notify"),
    REASSIGN("reassign"),
    ESCALATE("escalate"),
    PAUSE_BILLING("pause_billing"),
    CREATE_TASK("create_task"),
    UNKNOWN("unknown");

    private final String value;

    BreachActionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BreachActionType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (BreachActionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
