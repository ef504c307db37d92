package com.company.sla.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleResponse {
    private String breachId;
    private boolean success;
}
