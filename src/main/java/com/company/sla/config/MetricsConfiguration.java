package com.company.sla.config;

import com.company.sla.repository.SlaBreachRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SlaBreachRepository breachRepository;

    @Bean
    public MeterBinder slaMetrics() {
        return registry -> {
            Gauge.builder("sla.breaches.active", breachRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active SLA breaches", e);
                            return 0;
                        }
                    })
                    .description("Breaches in detected, acknowledged or escalated state")
                    .register(registry);

            log.info("SLA metrics registered");
        };
    }
}
