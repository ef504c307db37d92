package com.company.sla.exception;

public class PolicyNotFoundException extends RuntimeException {
    public PolicyNotFoundException(String slaId) {
        super("SLA definition not found: " + slaId);
    }
}
