package com.company.sla.dto.response;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaBreachEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreachDetailResponse {
    private SlaBreach breach;
    private String slaName;
    private List<SlaBreachEvent> events;
}
