package com.company.sla.exception;

public class PolicyInUseException extends RuntimeException {
    public PolicyInUseException(String slaId) {
        super("SLA definition " + slaId + " is referenced by breaches; only its status can change");
    }
}
