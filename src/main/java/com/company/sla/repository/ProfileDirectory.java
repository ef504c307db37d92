package com.company.sla.repository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to user profiles of the host application.
 */
public interface ProfileDirectory {

    Optional<String> findDisplayName(String profileId);

    boolean exists(String profileId);

    /**
     * Tenants having at least one profile; these are the tenants a scan covers.
     */
    List<String> findTenantIds();
}
