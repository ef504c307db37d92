package com.company.sla.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcProfileDirectory implements ProfileDirectory {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> findDisplayName(String profileId) {
        List<String> names = jdbcTemplate.query(
                "SELECT COALESCE(full_name, id::text) FROM profiles WHERE id = ? LIMIT 1",
                (rs, rowNum) -> rs.getString(1), profileId);
        return names.isEmpty() ? Optional.empty() : Optional.of(names.get(0));
    }

    @Override
    public boolean exists(String profileId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM profiles WHERE id = ?)", Boolean.class, profileId);
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public List<String> findTenantIds() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT agency_id FROM profiles WHERE agency_id IS NOT NULL ORDER BY agency_id",
                String.class);
    }
}
