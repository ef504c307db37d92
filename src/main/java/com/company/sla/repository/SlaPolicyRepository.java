package com.company.sla.repository;

import com.company.sla.domain.SlaPolicy;
import com.company.sla.domain.enums.PolicyStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.format.TextStyle;
import java.util.*;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaPolicyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT id, agency_id, client_id, project_id, name, description, created_by, status,
               response_time_hours, resolution_time_hours, applies_to, task_priorities,
               business_hours_only, business_hours_start, business_hours_end, business_days,
               timezone, created_at, updated_at
        FROM sla_definitions
        """;

    public Optional<SlaPolicy> findById(String id) {
        List<SlaPolicy> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ?", new SlaPolicyRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<SlaPolicy> findByIdAndTenant(String id, String tenantId) {
        List<SlaPolicy> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ? AND agency_id = ?", new SlaPolicyRowMapper(), id, tenantId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<SlaPolicy> findByTenant(String tenantId) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE agency_id = ? ORDER BY name", new SlaPolicyRowMapper(), tenantId);
    }

    /**
     * Active policies, oldest first so that resolution ties are deterministic
     */
    public List<SlaPolicy> findActiveByTenant(String tenantId) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE agency_id = ? AND status = 'active' ORDER BY created_at, id",
                new SlaPolicyRowMapper(), tenantId);
    }

    public int countActive(String tenantId, String slaId) {
        Integer count;
        if (slaId != null) {
            count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM sla_definitions
                WHERE agency_id = ? AND status = 'active' AND id = ?
                """, Integer.class, tenantId, slaId);
        } else {
            count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM sla_definitions
                WHERE agency_id = ? AND status = 'active'
                """, Integer.class, tenantId);
        }
        return count != null ? count : 0;
    }

    public SlaPolicy insert(SlaPolicy policy) {
        Instant now = clock.instant();
        policy.setCreatedAt(now);
        policy.setUpdatedAt(now);
        if (policy.getStatus() == null) {
            policy.setStatus(PolicyStatus.ACTIVE);
        }

        String sql = """
            INSERT INTO sla_definitions (
                agency_id, client_id, project_id, name, description, created_by, status,
                response_time_hours, resolution_time_hours, applies_to, task_priorities,
                business_hours_only, business_hours_start, business_hours_end, business_days,
                timezone, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

        String id = jdbcTemplate.query(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            ps.setString(1, policy.getTenantId());
            ps.setString(2, policy.getClientId());
            ps.setString(3, policy.getProjectId());
            ps.setString(4, policy.getName());
            ps.setString(5, policy.getDescription());
            ps.setString(6, policy.getCreatedBy());
            ps.setString(7, policy.getStatus().getValue());
            ps.setBigDecimal(8, policy.getResponseTimeHours());
            ps.setBigDecimal(9, policy.getResolutionTimeHours());
            ps.setArray(10, toTextArray(connection, policy.getAppliesTo()));
            ps.setArray(11, toTextArray(connection, policy.getTaskPriorities()));
            ps.setObject(12, policy.getBusinessHoursOnly());
            ps.setObject(13, policy.getBusinessHoursStart());
            ps.setObject(14, policy.getBusinessHoursEnd());
            ps.setArray(15, toTextArray(connection, formatDays(policy.getBusinessDays())));
            ps.setString(16, policy.getTimezone());
            ps.setTimestamp(17, Timestamp.from(policy.getCreatedAt()));
            ps.setTimestamp(18, Timestamp.from(policy.getUpdatedAt()));
            return ps;
        }, (ResultSetExtractor<String>) rs -> rs.next() ? rs.getString(1) : null);

        policy.setId(id);
        log.info("Created SLA definition {} ({}) for tenant {}", id, policy.getName(), policy.getTenantId());
        return policy;
    }

    public int update(SlaPolicy policy) {
        policy.setUpdatedAt(clock.instant());

        String sql = """
            UPDATE sla_definitions
            SET client_id = ?, project_id = ?, name = ?, description = ?, status = ?,
                response_time_hours = ?, resolution_time_hours = ?, applies_to = ?, task_priorities = ?,
                business_hours_only = ?, business_hours_start = ?, business_hours_end = ?,
                business_days = ?, timezone = ?, updated_at = ?
            WHERE id = ? AND agency_id = ?
            """;

        return jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            ps.setString(1, policy.getClientId());
            ps.setString(2, policy.getProjectId());
            ps.setString(3, policy.getName());
            ps.setString(4, policy.getDescription());
            ps.setString(5, policy.getStatus().getValue());
            ps.setBigDecimal(6, policy.getResponseTimeHours());
            ps.setBigDecimal(7, policy.getResolutionTimeHours());
            ps.setArray(8, toTextArray(connection, policy.getAppliesTo()));
            ps.setArray(9, toTextArray(connection, policy.getTaskPriorities()));
            ps.setObject(10, policy.getBusinessHoursOnly());
            ps.setObject(11, policy.getBusinessHoursStart());
            ps.setObject(12, policy.getBusinessHoursEnd());
            ps.setArray(13, toTextArray(connection, formatDays(policy.getBusinessDays())));
            ps.setString(14, policy.getTimezone());
            ps.setTimestamp(15, Timestamp.from(policy.getUpdatedAt()));
            ps.setString(16, policy.getId());
            ps.setString(17, policy.getTenantId());
            return ps;
        });
    }

    public int updateStatus(String id, String tenantId, PolicyStatus status) {
        return jdbcTemplate.update("""
            UPDATE sla_definitions
            SET status = ?, updated_at = NOW()
            WHERE id = ? AND agency_id = ?
            """, status.getValue(), id, tenantId);
    }

    public int delete(String id, String tenantId) {
        return jdbcTemplate.update(
                "DELETE FROM sla_definitions WHERE id = ? AND agency_id = ?", id, tenantId);
    }

    private static Array toTextArray(Connection connection, Collection<String> values) throws SQLException {
        if (values == null) {
            return null;
        }
        return connection.createArrayOf("text", values.toArray(new String[0]));
    }

    static List<String> formatDays(Set<DayOfWeek> days) {
        if (days == null) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (days.contains(day)) {
                names.add(day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
            }
        }
        return names;
    }

    public static Set<DayOfWeek> parseDays(String[] names) {
        if (names == null) {
            return null;
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String name : names) {
            for (DayOfWeek day : DayOfWeek.values()) {
                if (day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).equalsIgnoreCase(name)
                        || day.name().equalsIgnoreCase(name)) {
                    days.add(day);
                }
            }
        }
        return days;
    }

    private static class SlaPolicyRowMapper implements RowMapper<SlaPolicy> {
        @Override
        public SlaPolicy mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaPolicy.builder()
                    .id(rs.getString("id"))
                    .tenantId(rs.getString("agency_id"))
                    .clientId(rs.getString("client_id"))
                    .projectId(rs.getString("project_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .createdBy(rs.getString("created_by"))
                    .status(PolicyStatus.fromValue(rs.getString("status")))
                    .responseTimeHours(rs.getBigDecimal("response_time_hours"))
                    .resolutionTimeHours(rs.getBigDecimal("resolution_time_hours"))
                    .appliesTo(toSet(textArray(rs, "applies_to")))
                    .taskPriorities(toSet(textArray(rs, "task_priorities")))
                    .businessHoursOnly(rs.getObject("business_hours_only", Boolean.class))
                    .businessHoursStart(rs.getObject("business_hours_start", Integer.class))
                    .businessHoursEnd(rs.getObject("business_hours_end", Integer.class))
                    .businessDays(parseDays(textArray(rs, "business_days")))
                    .timezone(rs.getString("timezone"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private static String[] textArray(ResultSet rs, String column) throws SQLException {
            Array array = rs.getArray(column);
            return array != null ? (String[]) array.getArray() : null;
        }

        private static Set<String> toSet(String[] values) {
            return values != null ? new LinkedHashSet<>(Arrays.asList(values)) : null;
        }

        private static Instant getInstant(ResultSet rs, String column) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(column);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
