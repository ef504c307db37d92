package com.company.sla.domain;

import com.company.sla.domain.enums.PolicyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * Tenant-scoped SLA definition (sla_definitions row)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaPolicy {
    public static final int DEFAULT_BUSINESS_HOURS_START = 9;
    public static final int DEFAULT_BUSINESS_HOURS_END = 17;
    public static final String DEFAULT_TIMEZONE = "UTC";

    private String id;
    private String tenantId;

    // Optional scope, narrower wins
    private String clientId;
    private String projectId;

    private String name;
    private String description;
    private String createdBy;
    private PolicyStatus status;

    private BigDecimal responseTimeHours;
    private BigDecimal resolutionTimeHours;

    // Empty or null sets match everything
    private Set<String> appliesTo;
    private Set<String> taskPriorities;

    // Calendar
    private Boolean businessHoursOnly;
    private Integer businessHoursStart;
    private Integer businessHoursEnd;
    private Set<DayOfWeek> businessDays;
    private String timezone;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isActive() {
        return status == PolicyStatus.ACTIVE;
    }

    public boolean isProjectScoped() {
        return projectId != null;
    }

    public boolean isClientScoped() {
        return clientId != null && projectId == null;
    }

    public boolean isTenantWide() {
        return clientId == null && projectId == null;
    }

    public boolean appliesToResource(String resourceType) {
        return appliesTo == null || appliesTo.isEmpty() || appliesTo.contains(resourceType);
    }

    public boolean appliesToPriority(String priority) {
        return taskPriorities == null || taskPriorities.isEmpty()
                || priority == null || taskPriorities.contains(priority);
    }
}
