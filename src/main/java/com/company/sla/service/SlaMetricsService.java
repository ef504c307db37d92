package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.MetricsPeriod;
import com.company.sla.dto.response.SlaMetricsResponse;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.SlaPolicyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compliance figures derived from the breach history of a reporting window.
 * <p>
 * The compliance rate is a penalty heuristic, not a ratio of on-time items:
 * each breach per active policy costs ten points, floored at zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaMetricsService {

    private static final BigDecimal FULL_COMPLIANCE = BigDecimal.valueOf(100);
    private static final int PENALTY_PER_BREACH = 10;

    private final SlaBreachRepository breachRepository;
    private final SlaPolicyRepository policyRepository;
    private final Clock clock;

    @Value("${sla.metrics.zone:UTC}")
    private String metricsZone;

    @Cacheable(value = "slaMetrics",
            key = "#tenantId + ':' + #period + ':' + #slaId + ':' + #clientId")
    public SlaMetricsResponse getSlaMetrics(String tenantId, MetricsPeriod period, String slaId, String clientId) {
        Instant periodStart = period.windowStart(clock.instant().atZone(ZoneId.of(metricsZone))).toInstant();

        List<SlaBreach> breaches = breachRepository.findDetectedSince(tenantId, periodStart, slaId, clientId);

        int total = breaches.size();
        int resolved = 0;
        long durationSum = 0;
        int durationCount = 0;
        Map<String, Long> byType = new TreeMap<>();

        for (SlaBreach breach : breaches) {
            String type = breach.getBreachType() != null ? breach.getBreachType().getValue() : "unknown";
            byType.merge(type, 1L, Long::sum);

            if (breach.getStatus() == BreachStatus.RESOLVED || breach.getStatus() == BreachStatus.AUTO_RESOLVED) {
                resolved++;
                if (breach.getBreachDurationMinutes() != null) {
                    durationSum += breach.getBreachDurationMinutes();
                    durationCount++;
                }
            }
        }

        long averageResolution = durationCount > 0 ? Math.round((double) durationSum / durationCount) : 0L;
        int activePolicies = policyRepository.countActive(tenantId, slaId);

        log.debug("SLA metrics for tenant {} ({}): {} breaches, {} active policies",
                tenantId, period, total, activePolicies);

        return SlaMetricsResponse.builder()
                .tenantId(tenantId)
                .period(period.name().toLowerCase())
                .periodStart(periodStart)
                .slaId(slaId)
                .clientId(clientId)
                .complianceRate(complianceRate(total, activePolicies))
                .totalBreaches(total)
                .resolvedBreaches(resolved)
                .averageResolutionTime(averageResolution)
                .breachesByType(byType)
                .build();
    }

    static BigDecimal complianceRate(int totalBreaches, int activePolicies) {
        if (totalBreaches == 0 || activePolicies == 0) {
            return FULL_COMPLIANCE.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal penalty = BigDecimal.valueOf((long) totalBreaches * PENALTY_PER_BREACH)
                .divide(BigDecimal.valueOf(activePolicies), 10, RoundingMode.HALF_UP);
        return FULL_COMPLIANCE.subtract(penalty)
                .max(BigDecimal.ZERO)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
