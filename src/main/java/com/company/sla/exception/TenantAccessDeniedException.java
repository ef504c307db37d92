package com.company.sla.exception;

public class TenantAccessDeniedException extends RuntimeException {
    public TenantAccessDeniedException(String tenantId, String breachId) {
        super("Tenant " + tenantId + " does not have access to breach " + breachId);
    }
}
