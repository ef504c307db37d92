package com.company.sla.service;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaBreachEvent;
import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import com.company.sla.domain.enums.TriggeredBy;
import com.company.sla.domain.enums.WorkItemStatus;
import com.company.sla.exception.TenantAccessDeniedException;
import com.company.sla.repository.SlaBreachEventRepository;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.WorkItemStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BreachLifecycleService")
class BreachLifecycleServiceTest {

    private static final String TENANT = "agency-1";
    private static final String OTHER_TENANT = "agency-2";
    private static final Instant DEADLINE = Instant.parse("2024-03-04T10:00:00Z");

    @Mock
    private SlaBreachRepository breachRepository;
    @Mock
    private WorkItemStore workItemStore;
    @Mock
    private SlaBreachEventRepository eventRepository;

    private SimpleMeterRegistry meterRegistry;
    private SlaBreach breach;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        breach = SlaBreach.builder()
                .id("breach-1")
                .tenantId(TENANT)
                .slaId("sla-1")
                .resourceType("task")
                .resourceId("task-1")
                .breachType(BreachType.RESOLUTION_TIME)
                .status(BreachStatus.DETECTED)
                .currentEscalationLevel(0)
                .detectedAt(DEADLINE.plus(Duration.ofMinutes(1)))
                .deadlineAt(DEADLINE)
                .build();

        when(breachRepository.findById("breach-1")).thenReturn(Optional.of(breach));
        when(breachRepository.acknowledge(anyString(), anyString(), any(), anyString(), any())).thenReturn(1);
        when(breachRepository.resolve(anyString(), anyString(), any(), any(), anyString(), anyInt())).thenReturn(1);
    }

    private BreachLifecycleService serviceAt(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        BreachAuditService auditService = new BreachAuditService(eventRepository, meterRegistry, clock);
        return new BreachLifecycleService(breachRepository, workItemStore, auditService, meterRegistry, clock);
    }

    @Nested
    @DisplayName("resolveBreach")
    class ResolveBreach {

        @Test
        @DisplayName("Should record the minutes spent past the deadline")
        void shouldRecordBreachDuration() {
            Instant now = DEADLINE.plus(Duration.ofMinutes(90));

            boolean resolved = serviceAt(now).resolveBreach("breach-1", "user-1", TENANT, false);

            assertThat(resolved).isTrue();
            verify(breachRepository).resolve("breach-1", TENANT, BreachStatus.RESOLVED, now, "user-1", 90);
            assertThat(meterRegistry.counter("sla.breaches.resolved", "status", "resolved").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should mark automatic resolutions as auto_resolved and system-triggered")
        void shouldMarkAutoResolution() {
            Instant now = DEADLINE.plus(Duration.ofMinutes(30));

            serviceAt(now).resolveBreach("breach-1", TENANT, TENANT, true);

            verify(breachRepository).resolve("breach-1", TENANT, BreachStatus.AUTO_RESOLVED, now, TENANT, 30);
            ArgumentCaptor<SlaBreachEvent> captor = ArgumentCaptor.forClass(SlaBreachEvent.class);
            verify(eventRepository).append(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(BreachEventType.RESOLVED);
            assertThat(captor.getValue().getTriggeredBy()).isEqualTo(TriggeredBy.SYSTEM);
            assertThat(captor.getValue().getEventData()).containsEntry("autoResolved", true);
        }

        @Test
        @DisplayName("Should reject a breach of another tenant before writing anything")
        void shouldEnforceTenantScope() {
            BreachLifecycleService service = serviceAt(DEADLINE.plus(Duration.ofMinutes(5)));

            assertThatThrownBy(() -> service.resolveBreach("breach-1", "user-2", OTHER_TENANT, false))
                    .isInstanceOf(TenantAccessDeniedException.class);

            verify(breachRepository, never()).resolve(anyString(), anyString(), any(), any(), anyString(), anyInt());
            verifyNoInteractions(eventRepository);
        }

        @Test
        @DisplayName("Should refuse to resolve a breach twice")
        void shouldNotResolveTerminalBreach() {
            breach.setStatus(BreachStatus.RESOLVED);

            boolean resolved = serviceAt(DEADLINE.plus(Duration.ofMinutes(5)))
                    .resolveBreach("breach-1", "user-1", TENANT, false);

            assertThat(resolved).isFalse();
            verify(breachRepository, never()).resolve(anyString(), anyString(), any(), any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Should return false for an unknown breach")
        void shouldHandleMissingBreach() {
            when(breachRepository.findById("missing")).thenReturn(Optional.empty());

            assertThat(serviceAt(DEADLINE).resolveBreach("missing", "user-1", TENANT, false)).isFalse();
        }

        @Test
        @DisplayName("Should keep the resolution when the audit write fails")
        void shouldSurviveAuditFailure() {
            doThrow(new RuntimeException("db timeout")).when(eventRepository).append(any());

            boolean resolved = serviceAt(DEADLINE.plus(Duration.ofMinutes(5)))
                    .resolveBreach("breach-1", "user-1", TENANT, false);

            assertThat(resolved).isTrue();
            assertThat(meterRegistry.counter("sla.effects.failed", "effect", "audit_event").count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("acknowledgeBreach")
    class AcknowledgeBreach {

        @Test
        @DisplayName("Should acknowledge an active breach and record the notes")
        void shouldAcknowledge() {
            Instant now = DEADLINE.plus(Duration.ofMinutes(10));

            boolean acknowledged = serviceAt(now)
                    .acknowledgeBreach("breach-1", "user-1", TENANT, "Looking into it");

            assertThat(acknowledged).isTrue();
            verify(breachRepository).acknowledge("breach-1", TENANT, now, "user-1", "Looking into it");
            ArgumentCaptor<SlaBreachEvent> captor = ArgumentCaptor.forClass(SlaBreachEvent.class);
            verify(eventRepository).append(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(BreachEventType.ACKNOWLEDGED);
            assertThat(captor.getValue().getUserId()).isEqualTo("user-1");
        }

        @Test
        @DisplayName("Should reject a breach of another tenant")
        void shouldEnforceTenantScope() {
            BreachLifecycleService service = serviceAt(DEADLINE);

            assertThatThrownBy(() -> service.acknowledgeBreach("breach-1", "user-2", OTHER_TENANT, null))
                    .isInstanceOf(TenantAccessDeniedException.class);
            verify(breachRepository, never()).acknowledge(anyString(), anyString(), any(), anyString(), any());
        }

        @Test
        @DisplayName("Should not acknowledge a resolved breach")
        void shouldNotAcknowledgeResolvedBreach() {
            breach.setStatus(BreachStatus.AUTO_RESOLVED);

            assertThat(serviceAt(DEADLINE).acknowledgeBreach("breach-1", "user-1", TENANT, null)).isFalse();
        }

        @Test
        @DisplayName("Should return false when the breach was closed in the meantime")
        void shouldReportLostRace() {
            when(breachRepository.acknowledge(anyString(), anyString(), any(), anyString(), any())).thenReturn(0);

            assertThat(serviceAt(DEADLINE).acknowledgeBreach("breach-1", "user-1", TENANT, null)).isFalse();
            verifyNoInteractions(eventRepository);
        }
    }

    @Nested
    @DisplayName("autoResolveCompletedTasks")
    class AutoResolve {

        @Test
        @DisplayName("Should resolve breaches whose task was completed, crediting the acknowledger")
        void shouldResolveCompletedTasks() {
            breach.setAcknowledgedBy("user-9");
            SlaBreach openTaskBreach = SlaBreach.builder()
                    .id("breach-2").tenantId(TENANT).slaId("sla-1").resourceType("task").resourceId("task-2")
                    .breachType(BreachType.RESPONSE_TIME).status(BreachStatus.DETECTED)
                    .detectedAt(DEADLINE).deadlineAt(DEADLINE).build();

            when(breachRepository.findActiveByTenantAndResourceType(TENANT, "task"))
                    .thenReturn(List.of(breach, openTaskBreach));
            when(workItemStore.findById("task-1")).thenReturn(Optional.of(
                    WorkItem.builder().id("task-1").status(WorkItemStatus.COMPLETED).build()));
            when(workItemStore.findById("task-2")).thenReturn(Optional.of(
                    WorkItem.builder().id("task-2").status(WorkItemStatus.IN_PROGRESS).build()));

            Instant now = DEADLINE.plus(Duration.ofMinutes(45));
            int resolved = serviceAt(now).autoResolveCompletedTasks(TENANT);

            assertThat(resolved).isEqualTo(1);
            verify(breachRepository).resolve("breach-1", TENANT, BreachStatus.AUTO_RESOLVED, now, "user-9", 45);
            verify(breachRepository, never()).resolve(eq("breach-2"), anyString(), any(), any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Should fall back to the tenant as resolver when nobody acknowledged")
        void shouldUseTenantAsResolver() {
            when(breachRepository.findActiveByTenantAndResourceType(TENANT, "task")).thenReturn(List.of(breach));
            when(workItemStore.findById("task-1")).thenReturn(Optional.of(
                    WorkItem.builder().id("task-1").status(WorkItemStatus.CANCELLED).build()));

            Instant now = DEADLINE.plus(Duration.ofMinutes(5));
            serviceAt(now).autoResolveCompletedTasks(TENANT);

            verify(breachRepository).resolve("breach-1", TENANT, BreachStatus.AUTO_RESOLVED, now, TENANT, 5);
        }

        @Test
        @DisplayName("Should carry on when one breach fails")
        void shouldIsolateFailures() {
            SlaBreach second = SlaBreach.builder()
                    .id("breach-2").tenantId(TENANT).slaId("sla-1").resourceType("task").resourceId("task-2")
                    .breachType(BreachType.RESPONSE_TIME).status(BreachStatus.DETECTED)
                    .detectedAt(DEADLINE).deadlineAt(DEADLINE).build();
            when(breachRepository.findById("breach-2")).thenReturn(Optional.of(second));
            when(breachRepository.findActiveByTenantAndResourceType(TENANT, "task"))
                    .thenReturn(List.of(breach, second));
            when(workItemStore.findById("task-1")).thenThrow(new RuntimeException("connection reset"));
            when(workItemStore.findById("task-2")).thenReturn(Optional.of(
                    WorkItem.builder().id("task-2").status(WorkItemStatus.COMPLETED).build()));

            int resolved = serviceAt(DEADLINE.plus(Duration.ofMinutes(5))).autoResolveCompletedTasks(TENANT);

            assertThat(resolved).isEqualTo(1);
        }
    }
}
