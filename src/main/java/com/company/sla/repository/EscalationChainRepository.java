package com.company.sla.repository;

import com.company.sla.domain.EscalationLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class EscalationChainRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT id, agency_id, sla_id, level, escalate_after_minutes, profile_id,
               notify_in_app, reassign_task, created_at
        FROM escalation_chains
        """;

    public Optional<EscalationLevel> findLevel(String slaId, int level) {
        List<EscalationLevel> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE sla_id = ? AND level = ? LIMIT 1",
                new EscalationLevelRowMapper(), slaId, level);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<EscalationLevel> findBySlaId(String slaId) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE sla_id = ? ORDER BY level", new EscalationLevelRowMapper(), slaId);
    }

    public int findMaxLevel(String slaId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(level), 0) FROM escalation_chains WHERE sla_id = ?", Integer.class, slaId);
        return max != null ? max : 0;
    }

    public EscalationLevel insert(EscalationLevel level) {
        level.setCreatedAt(clock.instant());

        String id = jdbcTemplate.queryForObject("""
            INSERT INTO escalation_chains (
                agency_id, sla_id, level, escalate_after_minutes, profile_id,
                notify_in_app, reassign_task, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """, String.class,
                level.getTenantId(),
                level.getSlaId(),
                level.getLevel(),
                level.getEscalateAfterMinutes(),
                level.getProfileId(),
                level.getNotifyInApp(),
                level.getReassignTask(),
                Timestamp.from(level.getCreatedAt())
        );

        level.setId(id);
        return level;
    }

    private static class EscalationLevelRowMapper implements RowMapper<EscalationLevel> {
        @Override
        public EscalationLevel mapRow(ResultSet rs, int rowNum) throws SQLException {
            return EscalationLevel.builder()
                    .id(rs.getString("id"))
                    .tenantId(rs.getString("agency_id"))
                    .slaId(rs.getString("sla_id"))
                    .level(rs.getInt("level"))
                    .escalateAfterMinutes(rs.getInt("escalate_after_minutes"))
                    .profileId(rs.getString("profile_id"))
                    .notifyInApp(rs.getObject("notify_in_app", Boolean.class))
                    .reassignTask(rs.getObject("reassign_task", Boolean.class))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
