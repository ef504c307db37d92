package com.company.sla.domain.enums;

public enum WorkItemStatus {
    PENDING("Pending"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled"),
    OTHER(null);

    private final String value;

    WorkItemStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Open items are the ones an SLA clock still runs for.
     */
    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static WorkItemStatus fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        for (WorkItemStatus status : values()) {
            if (status.value != null && status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return OTHER;
    }
}
