package com.company.anomaly.repository;

import com.company.anomaly.domain.AnomalyCount;
import com.company.anomaly.domain.AnomalyCriteria;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcAnomalyEventRepository implements AnomalyEventRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonTags jsonTags;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT event_id, event_time, component, metric_name, observed_value, severity,
               threshold, reason, duration_minutes, resolved_at, cascade_incident_id,
               tags, created_at
        FROM anomaly_events
        """;

    @Override
    @Transactional
    public AnomalyEvent append(AnomalyEvent event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        if (event.getCreatedAt() == null) {
            event.setCreatedAt(clock.instant());
        }

        String sql = """
            INSERT INTO anomaly_events (
                event_id, event_time, component, metric_name, observed_value, severity,
                threshold, reason, duration_minutes, resolved_at, cascade_incident_id,
                tags, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

        jdbcTemplate.update(sql,
                event.getId(),
                Timestamp.from(event.getTimestamp()),
                event.getComponent().name(),
                event.getMetricName(),
                event.getObservedValue(),
                event.getSeverity().name(),
                event.getThreshold(),
                event.getReason(),
                event.getDurationEstimateMinutes(),
                event.getResolvedAt() != null ? Timestamp.from(event.getResolvedAt()) : null,
                event.getCascadeIncidentId(),
                jsonTags.write(event.getTags()),
                Timestamp.from(event.getCreatedAt())
        );

        // Hour buckets are UTC hours, whatever the session time zone
        String rollupSql = """
            INSERT INTO anomaly_summary_hourly (bucket_start, component, severity, anomaly_count)
            VALUES (?, ?, ?, 1)
            ON CONFLICT (bucket_start, component, severity)
            DO UPDATE SET anomaly_count = anomaly_summary_hourly.anomaly_count + 1
            """;

        jdbcTemplate.update(rollupSql,
                Timestamp.from(TimeUtils.truncateToHour(event.getTimestamp())),
                event.getComponent().name(),
                event.getSeverity().name());

        return event;
    }

    @Override
    public Optional<AnomalyEvent> findById(String id) {
        List<AnomalyEvent> rows = jdbcTemplate.query(
                SELECT_BASE + "WHERE event_id = ?", new AnomalyEventRowMapper(), id);
        return rows.stream().findFirst();
    }

    @Override
    public List<AnomalyEvent> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }

        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        String sql = SELECT_BASE + String.format("WHERE event_id IN (%s)", placeholders);

        return jdbcTemplate.query(sql, new AnomalyEventRowMapper(), ids.toArray());
    }

    @Override
    public List<AnomalyEvent> find(AnomalyCriteria criteria) {
        StringBuilder sql = new StringBuilder(SELECT_BASE).append("WHERE 1 = 1\n");
        List<Object> params = new ArrayList<>();

        if (criteria.getFrom() != null) {
            sql.append("AND event_time >= ?\n");
            params.add(Timestamp.from(criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            sql.append("AND event_time <= ?\n");
            params.add(Timestamp.from(criteria.getTo()));
        }
        if (criteria.getComponent() != null) {
            sql.append("AND component = ?\n");
            params.add(criteria.getComponent().name());
        }
        if (criteria.getSeverity() != null) {
            sql.append("AND severity = ?\n");
            params.add(criteria.getSeverity().name());
        }
        if (criteria.isOpenOnly()) {
            sql.append("AND resolved_at IS NULL\n");
        }
        sql.append("ORDER BY event_time DESC\nLIMIT ?");
        params.add(criteria.getLimit());

        return jdbcTemplate.query(sql.toString(), new AnomalyEventRowMapper(), params.toArray());
    }

    @Override
    public List<AnomalyEvent> findBetween(Instant from, Instant to) {
        String sql = SELECT_BASE + """
            WHERE event_time >= ? AND event_time <= ?
            ORDER BY event_time ASC, event_id ASC
            """;

        return jdbcTemplate.query(sql, new AnomalyEventRowMapper(),
                Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public List<AnomalyEvent> findOpenOlderThan(Severity severity, Instant cutoff, int limit) {
        String sql = SELECT_BASE + """
            WHERE resolved_at IS NULL
            AND severity = ?
            AND event_time < ?
            ORDER BY event_time ASC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new AnomalyEventRowMapper(),
                severity.name(), Timestamp.from(cutoff), limit);
    }

    @Override
    @Transactional
    public boolean resolve(String id, Instant resolvedAt) {
        String sql = """
            UPDATE anomaly_events
            SET resolved_at = ?
            WHERE event_id = ? AND resolved_at IS NULL
            RETURNING event_time, component, severity
            """;

        List<Object[]> resolved = jdbcTemplate.query(sql, (rs, rowNum) -> new Object[]{
                rs.getTimestamp("event_time"),
                rs.getString("component"),
                rs.getString("severity")
        }, Timestamp.from(resolvedAt), id);

        if (resolved.isEmpty()) {
            return false;
        }

        Object[] row = resolved.get(0);
        Instant eventTime = ((Timestamp) row[0]).toInstant();
        double resolutionSeconds = Math.max(0,
                (resolvedAt.toEpochMilli() - eventTime.toEpochMilli()) / 1000.0);

        String rollupSql = """
            UPDATE anomaly_summary_hourly
            SET resolved_count = resolved_count + 1,
                total_resolution_seconds = total_resolution_seconds + ?
            WHERE bucket_start = ?
            AND component = ? AND severity = ?
            """;

        jdbcTemplate.update(rollupSql, resolutionSeconds,
                Timestamp.from(TimeUtils.truncateToHour(eventTime)), row[1], row[2]);
        return true;
    }

    @Override
    public int linkToIncident(Collection<String> eventIds, String incidentId) {
        if (eventIds == null || eventIds.isEmpty()) {
            return 0;
        }

        String placeholders = String.join(",", Collections.nCopies(eventIds.size(), "?"));
        String sql = String.format("""
            UPDATE anomaly_events
            SET cascade_incident_id = ?
            WHERE cascade_incident_id IS NULL
            AND event_id IN (%s)
            """, placeholders);

        Object[] params = new Object[1 + eventIds.size()];
        params[0] = incidentId;
        int i = 1;
        for (String eventId : eventIds) {
            params[i++] = eventId;
        }

        return jdbcTemplate.update(sql, params);
    }

    @Override
    public List<AnomalyCount> summarize(Instant from, Instant to) {
        String sql = """
            SELECT component, severity,
                   COUNT(*) AS anomaly_count,
                   COUNT(resolved_at) AS resolved_count,
                   COALESCE(SUM(EXTRACT(EPOCH FROM (resolved_at - event_time)))
                            FILTER (WHERE resolved_at IS NOT NULL), 0) AS total_resolution_seconds
            FROM anomaly_events
            WHERE event_time >= ? AND event_time < ?
            GROUP BY component, severity
            """;

        return jdbcTemplate.query(sql, new AnomalyCountRowMapper(),
                Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public List<AnomalyCount> summarizeHourly(Instant fromHour, Instant toHour) {
        String sql = """
            SELECT component, severity,
                   SUM(anomaly_count) AS anomaly_count,
                   SUM(resolved_count) AS resolved_count,
                   SUM(total_resolution_seconds) AS total_resolution_seconds
            FROM anomaly_summary_hourly
            WHERE bucket_start >= ? AND bucket_start < ?
            GROUP BY component, severity
            """;

        return jdbcTemplate.query(sql, new AnomalyCountRowMapper(),
                Timestamp.from(fromHour), Timestamp.from(toHour));
    }

    private static class AnomalyCountRowMapper implements RowMapper<AnomalyCount> {
        @Override
        public AnomalyCount mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AnomalyCount.builder()
                    .component(Component.valueOf(rs.getString("component")))
                    .severity(Severity.valueOf(rs.getString("severity")))
                    .anomalyCount(rs.getLong("anomaly_count"))
                    .resolvedCount(rs.getLong("resolved_count"))
                    .totalResolutionSeconds(rs.getDouble("total_resolution_seconds"))
                    .build();
        }
    }

    private class AnomalyEventRowMapper implements RowMapper<AnomalyEvent> {
        @Override
        public AnomalyEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AnomalyEvent.builder()
                    .id(rs.getString("event_id"))
                    .timestamp(rs.getTimestamp("event_time").toInstant())
                    .component(Component.valueOf(rs.getString("component")))
                    .metricName(rs.getString("metric_name"))
                    .observedValue(rs.getDouble("observed_value"))
                    .severity(Severity.valueOf(rs.getString("severity")))
                    .threshold(rs.getObject("threshold", Double.class))
                    .reason(rs.getString("reason"))
                    .durationEstimateMinutes(rs.getObject("duration_minutes", Integer.class))
                    .resolvedAt(rs.getTimestamp("resolved_at") != null ?
                            rs.getTimestamp("resolved_at").toInstant() : null)
                    .cascadeIncidentId(rs.getString("cascade_incident_id"))
                    .tags(jsonTags.read(rs.getString("tags")))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
