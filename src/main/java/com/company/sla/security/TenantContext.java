package com.company.sla.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Tenant (agency) and user of the current request, taken from the JWT only.
 * Clients cannot pick a tenant through headers or query parameters.
 */
@Component
@Slf4j
public class TenantContext {

    public String getCurrentTenantId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AccessDeniedException("No authenticated user");
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String tenantId = jwt.getClaimAsString("tenant_id");

            if (tenantId == null) {
                tenantId = jwt.getClaimAsString("agency_id");
            }

            if (tenantId == null) {
                log.warn("No tenant_id claim in JWT for subject {}", jwt.getSubject());
                throw new AccessDeniedException("Token carries no tenant");
            }

            return tenantId;
        }

        log.warn("Unexpected authentication principal type: {}",
                authentication.getPrincipal().getClass());
        throw new AccessDeniedException("Unsupported authentication");
    }

    /**
     * Profile id of the caller (JWT subject)
     */
    public String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            return jwt.getClaimAsString("sub");
        }

        return "anonymous";
    }
}
