package com.company.sla.scheduled;

import com.company.sla.dto.response.ScanResult;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.service.SlaScanService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlaScanJob")
class SlaScanJobTest {

    @Mock
    private ProfileDirectory profileDirectory;
    @Mock
    private SlaScanService scanService;

    private SimpleMeterRegistry meterRegistry;
    private SlaScanJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new SlaScanJob(profileDirectory, scanService, meterRegistry);
    }

    @Test
    @DisplayName("Should scan the remaining tenants when one tenant fails")
    void shouldIsolateTenantFailures() {
        when(profileDirectory.findTenantIds()).thenReturn(List.of("agency-1", "agency-2", "agency-3"));
        when(scanService.scanTenant("agency-1")).thenReturn(ScanResult.builder().tenantId("agency-1").build());
        when(scanService.scanTenant("agency-2")).thenThrow(new RuntimeException("connection refused"));
        when(scanService.scanTenant("agency-3")).thenReturn(ScanResult.builder().tenantId("agency-3").build());

        job.scanAllTenants();

        verify(scanService).scanTenant("agency-3");
        assertThat(meterRegistry.counter("sla.scan.tenant_failures").count()).isEqualTo(1.0);
        assertThat(MDC.get("tenantId")).isNull();
    }

    @Test
    @DisplayName("Should abort the pass when tenants cannot be listed")
    void shouldAbortWhenTenantListFails() {
        when(profileDirectory.findTenantIds()).thenThrow(new RuntimeException("db down"));

        job.scanAllTenants();

        verify(scanService, never()).scanTenant(anyString());
        assertThat(meterRegistry.counter("sla.scan.failures").count()).isEqualTo(1.0);
    }
}
