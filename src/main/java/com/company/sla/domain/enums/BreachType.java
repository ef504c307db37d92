package com.company.sla.domain.enums;

public enum BreachType {
    RESPONSE_TIME("response_time", "No first response before the response deadline"),
    RESOLUTION_TIME("resolution_time", "Not resolved before the resolution deadline");

    private final String value;
    private final String description;

    BreachType(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Human readable label used in notification texts, e.g. "response time".
     */
    public String getLabel() {
        return value.replace('_', ' ');
    }

    public static BreachType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Breach type is required");
        }
        for (BreachType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown breach type: " + value);
    }
}
