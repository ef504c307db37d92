package com.company.sla.exception;

public class BreachNotFoundException extends RuntimeException {
    public BreachNotFoundException(String breachId) {
        super("SLA breach not found: " + breachId);
    }
}
