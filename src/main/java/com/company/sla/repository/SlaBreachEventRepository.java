package com.company.sla.repository;

import com.company.sla.domain.SlaBreachEvent;
import com.company.sla.domain.enums.BreachEventType;
import com.company.sla.domain.enums.TriggeredBy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit log, no update or delete.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaBreachEventRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SlaBreachEvent append(SlaBreachEvent event) {
        String sql = """
            INSERT INTO sla_breach_events (
                breach_id, event_type, event_data, triggered_by, user_id, created_at
            ) VALUES (?, ?, CAST(? AS jsonb), ?, ?, ?)
            RETURNING id
            """;

        String id = jdbcTemplate.queryForObject(sql, String.class,
                event.getBreachId(),
                event.getEventType().getValue(),
                toJson(event.getEventData()),
                event.getTriggeredBy().getValue(),
                event.getUserId(),
                Timestamp.from(event.getCreatedAt())
        );

        event.setId(id);
        return event;
    }

    public List<SlaBreachEvent> findByBreachId(String breachId) {
        String sql = """
            SELECT id, breach_id, event_type, event_data, triggered_by, user_id, created_at
            FROM sla_breach_events
            WHERE breach_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, new SlaBreachEventRowMapper(), breachId);
    }

    private String toJson(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event data is not serializable", e);
        }
    }

    private class SlaBreachEventRowMapper implements RowMapper<SlaBreachEvent> {
        @Override
        public SlaBreachEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaBreachEvent.builder()
                    .id(rs.getString("id"))
                    .breachId(rs.getString("breach_id"))
                    .eventType(BreachEventType.fromValue(rs.getString("event_type")))
                    .eventData(parseEventData(rs.getString("event_data")))
                    .triggeredBy(TriggeredBy.fromValue(rs.getString("triggered_by")))
                    .userId(rs.getString("user_id"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }

        private Map<String, Object> parseEventData(String json) {
            if (json == null) {
                return null;
            }
            try {
                return objectMapper.readValue(json, new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse event data", e);
                return null;
            }
        }
    }
}
