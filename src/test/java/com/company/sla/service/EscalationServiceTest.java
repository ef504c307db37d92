package com.company.sla.service;

import com.company.sla.domain.EscalationLevel;
import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaBreachEvent;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import com.company.sla.dto.response.EscalationResult;
import com.company.sla.exception.NotificationDeliveryException;
import com.company.sla.repository.EscalationChainRepository;
import com.company.sla.repository.ProfileDirectory;
import com.company.sla.repository.SlaBreachEventRepository;
import com.company.sla.repository.SlaBreachRepository;
import com.company.sla.repository.WorkItemStore;
import com.company.sla.util.AttemptedEffect;
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
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EscalationService")
class EscalationServiceTest {

    private static final String TENANT = "agency-1";
    private static final Instant T0 = Instant.parse("2024-03-04T09:00:00Z");

    @Mock
    private SlaBreachRepository breachRepository;
    @Mock
    private EscalationChainRepository chainRepository;
    @Mock
    private ProfileDirectory profileDirectory;
    @Mock
    private WorkItemStore workItemStore;
    @Mock
    private NotificationSink notificationSink;
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
                .breachType(BreachType.RESPONSE_TIME)
                .status(BreachStatus.DETECTED)
                .currentEscalationLevel(0)
                .detectedAt(T0)
                .deadlineAt(T0.minus(Duration.ofMinutes(1)))
                .build();

        EscalationLevel level1 = EscalationLevel.builder()
                .slaId("sla-1").level(1).escalateAfterMinutes(15).profileId("profile-a")
                .notifyInApp(true).reassignTask(false).build();
        EscalationLevel level2 = EscalationLevel.builder()
                .slaId("sla-1").level(2).escalateAfterMinutes(60).profileId("profile-b")
                .notifyInApp(true).reassignTask(true).build();

        when(breachRepository.findById("breach-1")).thenReturn(Optional.of(breach));
        when(breachRepository.findByTenantAndStatuses(eq(TENANT), any())).thenReturn(List.of(breach));
        when(breachRepository.markEscalated(eq("breach-1"), anyInt(), anyInt())).thenReturn(1);
        when(chainRepository.findLevel("sla-1", 1)).thenReturn(Optional.of(level1));
        when(chainRepository.findLevel("sla-1", 2)).thenReturn(Optional.of(level2));
        when(chainRepository.findLevel("sla-1", 3)).thenReturn(Optional.empty());
        when(profileDirectory.findDisplayName("profile-a")).thenReturn(Optional.of("Alice Admin"));
        when(profileDirectory.findDisplayName("profile-b")).thenReturn(Optional.of("Bob Boss"));
    }

    private EscalationService serviceAt(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        SlaNotificationService notificationService =
                new SlaNotificationService(notificationSink, profileDirectory, meterRegistry);
        BreachAuditService auditService = new BreachAuditService(eventRepository, meterRegistry, clock);
        return new EscalationService(breachRepository, chainRepository, profileDirectory, workItemStore,
                notificationService, auditService, meterRegistry, clock);
    }

    @Nested
    @DisplayName("processEscalations")
    class ProcessEscalations {

        @Test
        @DisplayName("Should escalate to level 1 and notify its profile once the threshold has passed")
        void shouldEscalateAfterThreshold() {
            int escalated = serviceAt(T0.plus(Duration.ofMinutes(16))).processEscalations(TENANT);

            assertThat(escalated).isEqualTo(1);
            verify(breachRepository).markEscalated("breach-1", 0, 1);
            verify(notificationSink).createNotification(
                    eq("profile-a"),
                    eq("sla_escalation"),
                    eq("SLA Breach Escalated"),
                    eq("A response time breach has been escalated to you (Level 1)"),
                    anyMap());
        }

        @Test
        @DisplayName("Should wait until the threshold is reached")
        void shouldNotEscalateBeforeThreshold() {
            int escalated = serviceAt(T0.plus(Duration.ofMinutes(14))).processEscalations(TENANT);

            assertThat(escalated).isZero();
            verify(breachRepository, never()).markEscalated(anyString(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("Should move a breach at most one level per call")
        void shouldAdvanceOneLevelPerCall() {
            // Both thresholds have passed, only level 1 is reached in this call
            int escalated = serviceAt(T0.plus(Duration.ofMinutes(90))).processEscalations(TENANT);

            assertThat(escalated).isEqualTo(1);
            verify(breachRepository).markEscalated("breach-1", 0, 1);
            verify(breachRepository, never()).markEscalated("breach-1", 1, 2);
        }

        @Test
        @DisplayName("Should leave acknowledged breaches alone by default")
        @SuppressWarnings("unchecked")
        void shouldExcludeAcknowledgedByDefault() {
            serviceAt(T0.plus(Duration.ofMinutes(16))).processEscalations(TENANT);

            ArgumentCaptor<Set<BreachStatus>> captor = ArgumentCaptor.forClass(Set.class);
            verify(breachRepository).findByTenantAndStatuses(eq(TENANT), captor.capture());
            assertThat(captor.getValue()).containsExactlyInAnyOrder(BreachStatus.DETECTED, BreachStatus.ESCALATED);
        }

        @Test
        @DisplayName("Should include acknowledged breaches when configured")
        @SuppressWarnings("unchecked")
        void shouldIncludeAcknowledgedWhenConfigured() {
            EscalationService service = serviceAt(T0.plus(Duration.ofMinutes(16)));
            ReflectionTestUtils.setField(service, "includeAcknowledged", true);

            service.processEscalations(TENANT);

            ArgumentCaptor<Set<BreachStatus>> captor = ArgumentCaptor.forClass(Set.class);
            verify(breachRepository).findByTenantAndStatuses(eq(TENANT), captor.capture());
            assertThat(captor.getValue()).contains(BreachStatus.ACKNOWLEDGED);
        }
    }

    @Nested
    @DisplayName("escalateBreach")
    class EscalateBreach {

        @Test
        @DisplayName("Should report the new level and the escalation target")
        void shouldReturnEscalationResult() {
            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isTrue();
            assertThat(result.getNewLevel()).isEqualTo(1);
            assertThat(result.getEscalatedTo()).isEqualTo("Alice Admin");
            assertThat(result.getActions()).containsExactly(AttemptedEffect.IN_APP_NOTIFICATION);
            assertThat(meterRegistry.counter("sla.escalations", "level", "1").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reassign the task when the level asks for it")
        void shouldReassignTask() {
            breach.setCurrentEscalationLevel(1);
            breach.setStatus(BreachStatus.ESCALATED);

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.getNewLevel()).isEqualTo(2);
            verify(workItemStore).addAssignment("task-1", "profile-b");
            assertThat(result.getActions())
                    .containsExactly(AttemptedEffect.IN_APP_NOTIFICATION, AttemptedEffect.TASK_REASSIGNED);
        }

        @Test
        @DisplayName("Should not escalate past the last chain level")
        void shouldStopAtLastLevel() {
            breach.setCurrentEscalationLevel(2);
            breach.setStatus(BreachStatus.ESCALATED);

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isFalse();
            assertThat(result.getNewLevel()).isEqualTo(2);
            verify(breachRepository, never()).markEscalated(anyString(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("Should return level 0 for an unknown breach")
        void shouldHandleMissingBreach() {
            when(breachRepository.findById("missing")).thenReturn(Optional.empty());

            EscalationResult result = serviceAt(T0).escalateBreach("missing");

            assertThat(result.isEscalated()).isFalse();
            assertThat(result.getNewLevel()).isZero();
        }

        @Test
        @DisplayName("Should not escalate a resolved breach")
        void shouldIgnoreResolvedBreach() {
            breach.setStatus(BreachStatus.RESOLVED);

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isFalse();
            verify(breachRepository, never()).markEscalated(anyString(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("Should back off when another pass changed the level first")
        void shouldBackOffOnConcurrentChange() {
            when(breachRepository.markEscalated("breach-1", 0, 1)).thenReturn(0);

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isFalse();
            assertThat(result.getNewLevel()).isZero();
            verify(notificationSink, never()).createNotification(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should keep the new level when the notification fails")
        void shouldKeepLevelWhenNotificationFails() {
            doThrow(new NotificationDeliveryException("sink down", new RuntimeException("timeout")))
                    .when(notificationSink).createNotification(any(), any(), any(), any(), any());

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isTrue();
            assertThat(result.getNewLevel()).isEqualTo(1);
            assertThat(result.getActions()).isEmpty();
            assertThat(result.getEffects())
                    .anySatisfy(effect -> {
                        assertThat(effect.getEffect()).isEqualTo(AttemptedEffect.IN_APP_NOTIFICATION);
                        assertThat(effect.isSucceeded()).isFalse();
                    });
            verify(eventRepository).append(any());
            assertThat(meterRegistry.counter("sla.effects.failed", "effect", AttemptedEffect.IN_APP_NOTIFICATION)
                    .count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should skip notification and reassignment when the profile no longer exists")
        void shouldSkipEffectsForMissingProfile() {
            when(profileDirectory.findDisplayName("profile-a")).thenReturn(Optional.empty());

            EscalationResult result = serviceAt(T0).escalateBreach("breach-1");

            assertThat(result.isEscalated()).isTrue();
            assertThat(result.getEscalatedTo()).isNull();
            verify(notificationSink, never()).createNotification(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should record the level change in the audit log")
        void shouldRecordEscalatedEvent() {
            serviceAt(T0).escalateBreach("breach-1");

            ArgumentCaptor<SlaBreachEvent> captor =
                    ArgumentCaptor.forClass(SlaBreachEvent.class);
            verify(eventRepository).append(captor.capture());
            Map<String, Object> data = captor.getValue().getEventData();
            assertThat(data).containsEntry("fromLevel", 0).containsEntry("toLevel", 1)
                    .containsEntry("escalatedTo", "Alice Admin");
        }
    }
}
