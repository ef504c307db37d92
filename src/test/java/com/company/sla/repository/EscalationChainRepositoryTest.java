package com.company.sla.repository;

import com.company.sla.domain.EscalationLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EscalationChainRepository")
class EscalationChainRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-04T09:30:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private EscalationChainRepository repository;
    private final List<Object> boundParameters = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = new EscalationChainRepository(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        when(jdbcTemplate.queryForObject(anyString(), eq(String.class), any(Object[].class)))
                .thenAnswer(invocation -> {
                    Object[] arguments = invocation.getArguments();
                    for (int i = 2; i < arguments.length; i++) {
                        boundParameters.add(arguments[i]);
                    }
                    return "level-1";
                });
    }

    @Test
    @DisplayName("Should stamp a new level with the injected clock")
    void shouldStampCreationFromClock() {
        EscalationLevel level = repository.insert(EscalationLevel.builder()
                .tenantId("agency-1")
                .slaId("sla-1")
                .level(1)
                .escalateAfterMinutes(0)
                .profileId("profile-1")
                .notifyInApp(true)
                .reassignTask(false)
                .build());

        assertThat(level.getId()).isEqualTo("level-1");
        assertThat(level.getCreatedAt()).isEqualTo(NOW);
        assertThat(boundParameters).contains(Timestamp.from(NOW));
    }
}
