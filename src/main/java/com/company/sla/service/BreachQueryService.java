package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.dto.request.BreachHistoryFilter;
import com.company.sla.dto.response.BreachDetailResponse;
import com.company.sla.exception.BreachNotFoundException;
import com.company.sla.exception.TenantAccessDeniedException;
import com.company.sla.repository.SlaBreachEventRepository;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.SlaPolicyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class BreachQueryService {

    private final SlaBreachRepository breachRepository;
    private final SlaBreachEventRepository eventRepository;
    private final SlaPolicyRepository policyRepository;

    @Value("${sla.history.default-limit:100}")
    private int defaultLimit;

    /**
     * Most recent breaches first, capped at the filter's limit or the configured default.
     */
    public List<SlaBreach> getBreachHistory(String tenantId, BreachHistoryFilter filter) {
        BreachHistoryFilter effective = filter != null ? filter : new BreachHistoryFilter();
        return breachRepository.findHistory(tenantId, effective, defaultLimit);
    }

    public BreachDetailResponse getBreachDetail(String tenantId, String breachId) {
        SlaBreach breach = breachRepository.findById(breachId)
                .orElseThrow(() -> new BreachNotFoundException(breachId));

        if (!tenantId.equals(breach.getTenantId())) {
            throw new TenantAccessDeniedException(tenantId, breachId);
        }

        String slaName = policyRepository.findById(breach.getSlaId())
                .map(SlaPolicy::getName)
                .orElse(null);

        return BreachDetailResponse.builder()
                .breach(breach)
                .slaName(slaName)
                .events(eventRepository.findByBreachId(breachId))
                .build();
    }
}
