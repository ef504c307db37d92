package com.company.sla.dto.response;

import com.company.sla.domain.SlaBreach;
import com.company.sla.util.AttemptedEffect;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A newly created breach with the side effects attempted after its insert
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectedBreach {
    private SlaBreach breach;
    private List<AttemptedEffect> effects;
}
