package com.company.sla.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Create or replace an SLA definition. Business days use short names (Mon, Tue, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSlaPolicyRequest {
    @NotBlank(message = "Name is required")
    private String name;

    private String description;
    private String clientId;
    private String projectId;

    @NotNull(message = "Response time is required")
    @DecimalMin(value = "0.0", message = "Response time must not be negative")
    private BigDecimal responseTimeHours;

    @NotNull(message = "Resolution time is required")
    @DecimalMin(value = "0.0", message = "Resolution time must not be negative")
    private BigDecimal resolutionTimeHours;

    private Set<String> appliesTo;
    private Set<String> taskPriorities;

    private Boolean businessHoursOnly;

    @Min(0)
    @Max(23)
    private Integer businessHoursStart;

    @Min(1)
    @Max(24)
    private Integer businessHoursEnd;

    private Set<String> businessDays;
    private String timezone;
}
