package com.company.sla.repository;

import com.company.sla.domain.WorkItem;

import java.util.List;
import java.util.Optional;

/**
 * Access to the host application's tasks and their staff assignments.
 */
public interface WorkItemStore {

    /**
     * Pending or in-progress tasks of the tenant, optionally narrowed to one project.
     */
    List<WorkItem> findOpenTasks(String tenantId, String projectId);

    Optional<WorkItem> findById(String taskId);

    boolean hasAssignment(String taskId);

    void addAssignment(String taskId, String profileId);
}
