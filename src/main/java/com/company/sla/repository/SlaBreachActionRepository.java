package com.company.sla.repository;

import com.company.sla.domain.SlaBreachAction;
import com.company.sla.domain.enums.BreachActionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaBreachActionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public List<SlaBreachAction> findEnabled(String slaId, String triggerAt) {
        String sql = """
            SELECT id, sla_id, action_type, trigger_at, config, enabled
            FROM sla_breach_actions
            WHERE sla_id = ?
              AND trigger_at = ?
              AND enabled = true
            ORDER BY created_at
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> SlaBreachAction.builder()
                .id(rs.getString("id"))
                .slaId(rs.getString("sla_id"))
                .actionType(BreachActionType.fromValue(rs.getString("action_type")))
                .triggerAt(rs.getString("trigger_at"))
                .config(parseConfig(rs.getString("config")))
                .enabled(rs.getBoolean("enabled"))
                .build(), slaId, triggerAt);
    }

    private Map<String, Object> parseConfig(String json) {
        if (json == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable breach action config: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
