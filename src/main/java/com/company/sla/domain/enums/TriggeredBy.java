package com.company.sla.domain.enums;

public enum TriggeredBy {
    SYSTEM("system"),
    USER("user");

    private final String value;

    TriggeredBy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TriggeredBy fromValue(String value) {
        return "user".equalsIgnoreCase(value) ? USER : SYSTEM;
    }
}
