package com.company.sla.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Appends the next level to a policy's escalation chain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEscalationLevelRequest {
    @NotNull(message = "Escalate-after minutes is required")
    @Min(value = 0, message = "Escalate-after minutes must not be negative")
    private Integer escalateAfterMinutes;

    @NotBlank(message = "Profile ID is required")
    private String profileId;

    private Boolean notifyInApp;
    private Boolean reassignTask;
}
