package com.company.sla.domain;

import com.company.sla.domain.enums.BreachActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaBreachAction {
    public static final String TRIGGER_BREACH = "breach";

    private String id;
    private String slaId;
    private BreachActionType actionType;
    private String triggerAt;
    private Map<String, Object> config;
    private Boolean enabled;
}
