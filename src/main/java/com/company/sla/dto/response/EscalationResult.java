package com.company.sla.dto.response;

import com.company.sla.util.AttemptedEffect;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationResult {
    private boolean escalated;
    private int newLevel;
    private String escalatedTo;

    // Effects that succeeded, e.g. in_app_notification, task_reassigned
    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @Builder.Default
    private List<AttemptedEffect> effects = new ArrayList<>();

    public static EscalationResult notEscalated(int level) {
        return EscalationResult.builder()
                .escalated(false)
                .newLevel(level)
                .build();
    }
}
