package com.company.sla.domain;

import com.company.sla.domain.enums.WorkItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a task owned by the host application
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItem {
    public static final String RESOURCE_TYPE_TASK = "task";

    private String id;
    private String tenantId;
    private String projectId;
    private String clientId;
    private WorkItemStatus status;
    private String priority;
    private Instant createdAt;
}
