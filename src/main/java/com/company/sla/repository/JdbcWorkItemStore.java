package com.company.sla.repository;

import com.company.sla.domain.WorkItem;
import com.company.sla.domain.enums.WorkItemStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcWorkItemStore implements WorkItemStore {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT t.id, t.project_id, t.status, t.priority, t.created_at,
               tl.agency_id, p.client_id
        FROM tasks t
        JOIN task_lists tl ON tl.id = t.list_id
        LEFT JOIN projects p ON p.id = t.project_id
        """;

    @Override
    public List<WorkItem> findOpenTasks(String tenantId, String projectId) {
        StringBuilder sql = new StringBuilder(SELECT_BASE)
                .append(" WHERE tl.agency_id = ? AND t.status IN (?, ?)");
        List<Object> params = new ArrayList<>();
        params.add(tenantId);
        params.add(WorkItemStatus.PENDING.getValue());
        params.add(WorkItemStatus.IN_PROGRESS.getValue());

        if (projectId != null) {
            sql.append(" AND t.project_id = ?");
            params.add(projectId);
        }

        return jdbcTemplate.query(sql.toString(), new WorkItemRowMapper(), params.toArray());
    }

    @Override
    public Optional<WorkItem> findById(String taskId) {
        List<WorkItem> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE t.id = ? LIMIT 1", new WorkItemRowMapper(), taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean hasAssignment(String taskId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM staff_assignments WHERE task_id = ?)",
                Boolean.class, taskId);
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void addAssignment(String taskId, String profileId) {
        jdbcTemplate.update(
                "INSERT INTO staff_assignments (task_id, staff_profile_id) VALUES (?, ?)",
                taskId, profileId);
    }

    private static class WorkItemRowMapper implements RowMapper<WorkItem> {
        @Override
        public WorkItem mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return WorkItem.builder()
                    .id(rs.getString("id"))
                    .tenantId(rs.getString("agency_id"))
                    .projectId(rs.getString("project_id"))
                    .clientId(rs.getString("client_id"))
                    .status(WorkItemStatus.fromValue(rs.getString("status")))
                    .priority(rs.getString("priority"))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .build();
        }
    }
}
