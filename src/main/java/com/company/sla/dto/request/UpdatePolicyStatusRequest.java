package com.company.sla.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePolicyStatusRequest {
    @NotBlank(message = "Status is required (active, paused or archived)")
    private String status;
}
