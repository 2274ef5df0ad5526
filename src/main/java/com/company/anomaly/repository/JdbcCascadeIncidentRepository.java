package com.company.anomaly.repository;

import com.company.anomaly.domain.CascadeIncident;
import com.company.anomaly.domain.IncidentLink;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.IncidentPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcCascadeIncidentRepository implements CascadeIncidentRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Unique dedupe_key makes this idempotent; caller handles DuplicateKeyException.
     * Runs inside the correlator's per-incident transaction.
     */
    @Override
    public CascadeIncident save(CascadeIncident incident) throws DuplicateKeyException {
        if (incident.getId() == null) {
            incident.setId(UUID.randomUUID().toString());
        }
        if (incident.getCreatedAt() == null) {
            incident.setCreatedAt(clock.instant());
        }

        String sql = """
            INSERT INTO cascade_incidents (
                incident_id, dedupe_key, pattern, start_time, end_time, confidence, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                incident.getId(),
                incident.getDedupeKey(),
                incident.getPattern().name(),
                Timestamp.from(incident.getStartTime()),
                Timestamp.from(incident.getEndTime()),
                incident.getConfidence(),
                Timestamp.from(incident.getCreatedAt())
        );

        String linkSql = """
            INSERT INTO cascade_incident_events (incident_id, position, component, event_id)
            VALUES (?, ?, ?, ?)
            """;

        List<Object[]> batch = new ArrayList<>();
        for (IncidentLink link : incident.getLinks()) {
            batch.add(new Object[]{
                    incident.getId(), link.getPosition(), link.getComponent().name(), link.getEventId()
            });
        }
        jdbcTemplate.batchUpdate(linkSql, batch);

        return incident;
    }

    @Override
    public boolean existsByDedupeKey(String dedupeKey) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cascade_incidents WHERE dedupe_key = ?",
                Integer.class, dedupeKey);
        return count != null && count > 0;
    }

    @Override
    public List<CascadeIncident> findOverlapping(Instant from, Instant to) {
        String sql = """
            SELECT incident_id, dedupe_key, pattern, start_time, end_time, confidence, created_at
            FROM cascade_incidents
            WHERE start_time <= ? AND end_time >= ?
            ORDER BY start_time DESC
            """;

        List<CascadeIncident> incidents = jdbcTemplate.query(sql, new CascadeIncidentRowMapper(),
                Timestamp.from(to), Timestamp.from(from));

        if (incidents.isEmpty()) {
            return incidents;
        }

        Map<String, List<IncidentLink>> links = findLinks(
                incidents.stream().map(CascadeIncident::getId).toList());
        incidents.forEach(incident ->
                incident.setLinks(links.getOrDefault(incident.getId(), List.of())));

        return incidents;
    }

    private Map<String, List<IncidentLink>> findLinks(List<String> incidentIds) {
        String placeholders = String.join(",", Collections.nCopies(incidentIds.size(), "?"));
        String sql = String.format("""
            SELECT incident_id, position, component, event_id
            FROM cascade_incident_events
            WHERE incident_id IN (%s)
            ORDER BY incident_id, position
            """, placeholders);

        Map<String, List<IncidentLink>> result = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            result.computeIfAbsent(rs.getString("incident_id"), k -> new ArrayList<>())
                    .add(new IncidentLink(
                            rs.getInt("position"),
                            Component.valueOf(rs.getString("component")),
                            rs.getString("event_id")));
        }, incidentIds.toArray());

        return result;
    }

    private static class CascadeIncidentRowMapper implements RowMapper<CascadeIncident> {
        @Override
        public CascadeIncident mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CascadeIncident.builder()
                    .id(rs.getString("incident_id"))
                    .dedupeKey(rs.getString("dedupe_key"))
                    .pattern(IncidentPattern.valueOf(rs.getString("pattern")))
                    .startTime(rs.getTimestamp("start_time").toInstant())
                    .endTime(rs.getTimestamp("end_time").toInstant())
                    .confidence(rs.getDouble("confidence"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
