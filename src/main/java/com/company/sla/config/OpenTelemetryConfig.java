package com.company.sla.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenTelemetryConfig {

    /**
     * Exporters are configured through the standard OTEL_* environment variables.
     * With sla.tracing.enabled=false the no-op implementation is used.
     */
    @Bean
    @ConditionalOnProperty(value = "sla.tracing.enabled", havingValue = "true", matchIfMissing = true)
    public OpenTelemetry openTelemetry() {
        return AutoConfiguredOpenTelemetrySdk.initialize().getOpenTelemetrySdk();
    }

    @Bean
    @ConditionalOnProperty(value = "sla.tracing.enabled", havingValue = "false")
    public OpenTelemetry noopOpenTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("sla-escalation-service");
    }
}
