package com.company.sla.repository;

import com.company.sla.domain.EscalationLevel;
import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.SlaPolicy;
import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import com.company.sla.domain.enums.PolicyStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@JdbcTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({SlaBreachRepository.class, SlaPolicyRepository.class, EscalationChainRepository.class,
        SlaBreachRepositoryTest.FixedClockConfig.class})
@DisplayName("SlaBreachRepository Integration Tests")
class SlaBreachRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("agency_test")
            .withUsername("test")
            .withPassword("test")
            .withUrlParam("stringtype", "unspecified");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private SlaBreachRepository breachRepository;

    @Autowired
    private SlaPolicyRepository policyRepository;

    @Autowired
    private EscalationChainRepository chainRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final String tenantId = UUID.randomUUID().toString();
    private final String taskId = UUID.randomUUID().toString();
    private String slaId;

    @BeforeEach
    void setUp() {
        SlaPolicy policy = policyRepository.insert(SlaPolicy.builder()
                .tenantId(tenantId)
                .name("Standard")
                .status(PolicyStatus.ACTIVE)
                .responseTimeHours(BigDecimal.ONE)
                .resolutionTimeHours(new BigDecimal("8"))
                .businessHoursOnly(false)
                .timezone("UTC")
                .build());
        slaId = policy.getId();
    }

    private SlaBreach newBreach() {
        return SlaBreach.builder()
                .tenantId(tenantId)
                .slaId(slaId)
                .resourceType(WorkItem.RESOURCE_TYPE_TASK)
                .resourceId(taskId)
                .breachType(BreachType.RESPONSE_TIME)
                .status(BreachStatus.DETECTED)
                .currentEscalationLevel(0)
                .detectedAt(NOW)
                .deadlineAt(NOW.minus(Duration.ofMinutes(30)))
                .build();
    }

    @Test
    @DisplayName("Should reject a second active breach for the same policy and task")
    void shouldRejectDuplicateActiveBreach() {
        // Given
        SlaBreach first = breachRepository.insert(newBreach());

        // Then
        assertThat(first.getId()).isNotNull();
        assertThat(breachRepository.existsActiveBreach(slaId, taskId)).isTrue();

        // Last statement: the failed insert aborts the test transaction
        assertThatThrownBy(() -> breachRepository.insert(newBreach()))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("Should allow a new breach once the previous one is resolved")
    void shouldAllowNewBreachAfterResolution() {
        // Given
        SlaBreach first = breachRepository.insert(newBreach());
        breachRepository.resolve(first.getId(), tenantId, BreachStatus.RESOLVED, NOW, null, 30);

        // When
        SlaBreach second = breachRepository.insert(newBreach());

        // Then
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(breachRepository.existsActiveBreach(slaId, taskId)).isTrue();
    }

    @Test
    @DisplayName("Should apply an escalation step only from the expected level")
    void shouldRejectStaleEscalationStep() {
        // Given
        SlaBreach breach = breachRepository.insert(newBreach());

        // When
        int firstStep = breachRepository.markEscalated(breach.getId(), 0, 1);
        int staleStep = breachRepository.markEscalated(breach.getId(), 0, 1);

        // Then
        assertThat(firstStep).isEqualTo(1);
        assertThat(staleStep).isZero();
        SlaBreach stored = breachRepository.findById(breach.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(BreachStatus.ESCALATED);
        assertThat(stored.getCurrentEscalationLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not let another tenant acknowledge or resolve a breach")
    void shouldScopeLifecycleWritesToTenant() {
        // Given
        SlaBreach breach = breachRepository.insert(newBreach());
        String otherTenant = UUID.randomUUID().toString();

        // When
        int foreignAcknowledge = breachRepository.acknowledge(breach.getId(), otherTenant, NOW, null, "mine");
        int foreignResolve = breachRepository.resolve(breach.getId(), otherTenant, BreachStatus.RESOLVED, NOW, null, 30);

        // Then
        assertThat(foreignAcknowledge).isZero();
        assertThat(foreignResolve).isZero();
        assertThat(breachRepository.findById(breach.getId()).orElseThrow().getStatus())
                .isEqualTo(BreachStatus.DETECTED);

        assertThat(breachRepository.resolve(breach.getId(), tenantId, BreachStatus.RESOLVED, NOW, null, 30))
                .isEqualTo(1);
        assertThat(breachRepository.resolve(breach.getId(), tenantId, BreachStatus.RESOLVED, NOW, null, 30))
                .isZero();
    }

    @Test
    @DisplayName("Should store the injected clock as the creation time of an escalation level")
    void shouldStampEscalationLevelFromClock() {
        // When
        EscalationLevel level = chainRepository.insert(EscalationLevel.builder()
                .tenantId(tenantId)
                .slaId(slaId)
                .level(1)
                .escalateAfterMinutes(0)
                .notifyInApp(true)
                .reassignTask(false)
                .build());

        // Then
        Timestamp stored = jdbcTemplate.queryForObject(
                "SELECT created_at FROM escalation_chains WHERE id = ?", Timestamp.class, level.getId());
        assertThat(stored.toInstant()).isEqualTo(NOW);
    }
}
