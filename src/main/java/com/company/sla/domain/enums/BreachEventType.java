package com.company.sla.domain.enums;

public enum BreachEventType {
    DETECTED("detected"),
    ESCALATED("escalated"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved");

    private final String value;

    BreachEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BreachEventType fromValue(String value) {
        for (BreachEventType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown breach event type: " + value);
    }
}
