package com.company.sla.repository;

import com.company.sla.domain.SlaBreach;
import com.company.sla.domain.enums.BreachStatus;
import com.company.sla.domain.enums.BreachType;
import com.company.sla.dto.request.BreachHistoryFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * Breach rows are only inserted and updated here, never deleted.
 * A partial unique index on (sla_id, resource_id) over active statuses backs the
 * one-active-breach-per-item rule.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaBreachRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String ACTIVE_STATUSES = "('detected', 'acknowledged', 'escalated')";

    private static final String SELECT_BASE = """
        SELECT b.id, b.agency_id, b.sla_id, b.resource_type, b.resource_id, b.breach_type, b.status,
               b.current_escalation_level, b.detected_at, b.deadline_at,
               b.acknowledged_at, b.acknowledged_by, b.resolved_at, b.resolved_by,
               b.actual_resolution_at, b.breach_duration_minutes, b.notes
        FROM sla_breaches b
        """;

    /**
     * Throws DuplicateKeyException when an active breach already exists for (slaId, resourceId).
     * Caller must handle it.
     */
    public SlaBreach insert(SlaBreach breach) throws DuplicateKeyException {
        String sql = """
            INSERT INTO sla_breaches (
                agency_id, sla_id, resource_type, resource_id, breach_type, status,
                current_escalation_level, detected_at, deadline_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

        String id = jdbcTemplate.queryForObject(sql, String.class,
                breach.getTenantId(),
                breach.getSlaId(),
                breach.getResourceType(),
                breach.getResourceId(),
                breach.getBreachType().getValue(),
                breach.getStatus().getValue(),
                breach.escalationLevel(),
                Timestamp.from(breach.getDetectedAt()),
                Timestamp.from(breach.getDeadlineAt())
        );

        breach.setId(id);
        return breach;
    }

    public Optional<SlaBreach> findById(String id) {
        List<SlaBreach> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE b.id = ?", new SlaBreachRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean existsActiveBreach(String slaId, String resourceId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sla_breaches WHERE sla_id = ? AND resource_id = ? AND status IN "
                        + ACTIVE_STATUSES,
                Integer.class, slaId, resourceId);
        return count != null && count > 0;
    }

    public boolean existsBySlaId(String slaId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sla_breaches WHERE sla_id = ?", Integer.class, slaId);
        return count != null && count > 0;
    }

    public List<SlaBreach> findByTenantAndStatuses(String tenantId, Collection<BreachStatus> statuses) {
        if (statuses.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = String.join(",", Collections.nCopies(statuses.size(), "?"));
        List<Object> params = new ArrayList<>();
        params.add(tenantId);
        statuses.forEach(status -> params.add(status.getValue()));

        return jdbcTemplate.query(
                SELECT_BASE + " WHERE b.agency_id = ? AND b.status IN (" + placeholders + ") ORDER BY b.detected_at",
                new SlaBreachRowMapper(), params.toArray());
    }

    public List<SlaBreach> findActiveByTenantAndResourceType(String tenantId, String resourceType) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE b.agency_id = ? AND b.resource_type = ? AND b.status IN "
                        + ACTIVE_STATUSES + " ORDER BY b.detected_at",
                new SlaBreachRowMapper(), tenantId, resourceType);
    }

    /**
     * Compare-and-set on the level so a level is never skipped or repeated
     * when two escalation passes race.
     */
    public int markEscalated(String id, int fromLevel, int toLevel) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET status = 'escalated',
                current_escalation_level = ?
            WHERE id = ?
              AND COALESCE(current_escalation_level, 0) = ?
              AND status IN
            """ + ACTIVE_STATUSES, toLevel, id, fromLevel);
    }

    public int acknowledge(String id, String tenantId, Instant acknowledgedAt, String userId, String notes) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET status = 'acknowledged',
                acknowledged_at = ?,
                acknowledged_by = ?,
                notes = COALESCE(?, notes)
            WHERE id = ?
              AND agency_id = ?
              AND status IN
            """ + ACTIVE_STATUSES,
                Timestamp.from(acknowledgedAt), userId, notes, id, tenantId);
    }

    public int resolve(String id, String tenantId, BreachStatus status, Instant resolvedAt,
                       String userId, int breachDurationMinutes) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET status = ?,
                resolved_at = ?,
                resolved_by = ?,
                actual_resolution_at = ?,
                breach_duration_minutes = ?
            WHERE id = ?
              AND agency_id = ?
              AND status IN
            """ + ACTIVE_STATUSES,
                status.getValue(), Timestamp.from(resolvedAt), userId, Timestamp.from(resolvedAt),
                breachDurationMinutes, id, tenantId);
    }

    public List<SlaBreach> findHistory(String tenantId, BreachHistoryFilter filter, int defaultLimit) {
        StringBuilder sql = new StringBuilder(SELECT_BASE);
        List<Object> params = new ArrayList<>();

        if (filter.getClientId() != null) {
            sql.append(" JOIN sla_definitions d ON d.id = b.sla_id AND d.client_id = ?");
            params.add(filter.getClientId());
        }

        sql.append(" WHERE b.agency_id = ?");
        params.add(tenantId);

        if (filter.getSlaId() != null) {
            sql.append(" AND b.sla_id = ?");
            params.add(filter.getSlaId());
        }
        if (filter.getStatus() != null) {
            sql.append(" AND b.status = ?");
            params.add(filter.getStatus().getValue());
        }
        if (filter.getStartDate() != null) {
            sql.append(" AND b.detected_at >= ?");
            params.add(Timestamp.from(filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            sql.append(" AND b.detected_at <= ?");
            params.add(Timestamp.from(filter.getEndDate()));
        }

        sql.append(" ORDER BY b.detected_at DESC LIMIT ?");
        params.add(filter.getLimit() != null ? filter.getLimit() : defaultLimit);

        return jdbcTemplate.query(sql.toString(), new SlaBreachRowMapper(), params.toArray());
    }

    /**
     * Breaches detected at or after {@code since}, optionally narrowed to one policy
     * or to the policies scoped to one client
     */
    public List<SlaBreach> findDetectedSince(String tenantId, Instant since, String slaId, String clientId) {
        BreachHistoryFilter filter = BreachHistoryFilter.builder()
                .slaId(slaId)
                .clientId(clientId)
                .startDate(since)
                .build();
        return findHistory(tenantId, filter, Integer.MAX_VALUE);
    }

    public long countActive() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sla_breaches WHERE status IN " + ACTIVE_STATUSES, Long.class);
        return count != null ? count : 0L;
    }

    private static class SlaBreachRowMapper implements RowMapper<SlaBreach> {
        @Override
        public SlaBreach mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaBreach.builder()
                    .id(rs.getString("id"))
                    .tenantId(rs.getString("agency_id"))
                    .slaId(rs.getString("sla_id"))
                    .resourceType(rs.getString("resource_type"))
                    .resourceId(rs.getString("resource_id"))
                    .breachType(BreachType.fromValue(rs.getString("breach_type")))
                    .status(BreachStatus.fromValue(rs.getString("status")))
                    .currentEscalationLevel(rs.getObject("current_escalation_level", Integer.class))
                    .detectedAt(getInstant(rs, "detected_at"))
                    .deadlineAt(getInstant(rs, "deadline_at"))
                    .acknowledgedAt(getInstant(rs, "acknowledged_at"))
                    .acknowledgedBy(rs.getString("acknowledged_by"))
                    .resolvedAt(getInstant(rs, "resolved_at"))
                    .resolvedBy(rs.getString("resolved_by"))
                    .actualResolutionAt(getInstant(rs, "actual_resolution_at"))
                    .breachDurationMinutes(rs.getObject("breach_duration_minutes", Integer.class))
                    .notes(rs.getString("notes"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String column) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(column);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
