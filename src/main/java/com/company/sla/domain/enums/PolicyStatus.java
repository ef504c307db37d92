package com.company.sla.domain.enums;

public enum PolicyStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    ARCHIVED("archived");

    private final String value;

    PolicyStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PolicyStatus fromValue(String value) {
        if (value == null) {
            return ACTIVE;
        }
        for (PolicyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown policy status: " + value);
    }
}
