package com.company.sla.dto.request;

import com.company.sla.domain.enums.BreachStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreachHistoryFilter {
    private String slaId;
    private String clientId;
    private BreachStatus status;
    private Instant startDate;
    private Instant endDate;
    private Integer limit;
}
