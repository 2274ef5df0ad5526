package com.company.anomaly.repository;

import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.MetricSummary;
import com.company.anomaly.domain.enums.Component;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw sample storage. Rows land in the daily partition of their arrival time.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcMetricSampleRepository implements MetricSampleRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonTags jsonTags;

    private static final String SELECT_BASE = """
        SELECT sample_time, component, metric_name, value, unit,
               host, cluster, environment, tags
        FROM metric_samples
        """;

    @Override
    public void append(MetricSample sample, Instant receivedAt) {
        String sql = """
            INSERT INTO metric_samples (
                sample_time, received_at, component, metric_name, value,
                unit, host, cluster, environment, tags
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            """;

        jdbcTemplate.update(sql,
                Timestamp.from(sample.getTimestamp()),
                Timestamp.from(receivedAt),
                sample.getComponent().name(),
                sample.getMetricName(),
                sample.getValue(),
                sample.getUnit(),
                sample.getHost(),
                sample.getCluster(),
                sample.getEnvironment(),
                jsonTags.write(sample.getTags())
        );
    }

    @Override
    public List<MetricSample> findRange(Component component, String metricName, Instant from, Instant to) {
        String sql = SELECT_BASE + """
            WHERE component = ? AND metric_name = ?
            AND sample_time >= ? AND sample_time < ?
            ORDER BY sample_time ASC
            """;

        return jdbcTemplate.query(sql, new MetricSampleRowMapper(),
                component.name(), metricName, Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public List<MetricSample> findRecent(int lastMinutes, Component component, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_BASE)
                .append("WHERE sample_time >= NOW() - make_interval(mins => ?)\n");
        List<Object> params = new ArrayList<>();
        params.add(lastMinutes);

        if (component != null) {
            sql.append("AND component = ?\n");
            params.add(component.name());
        }
        sql.append("ORDER BY sample_time DESC\nLIMIT ?");
        params.add(limit);

        return jdbcTemplate.query(sql.toString(), new MetricSampleRowMapper(), params.toArray());
    }

    @Override
    public List<MetricSummary> summarizeRecent(int lastMinutes) {
        String sql = """
            SELECT component, metric_name,
                   AVG(value) AS avg_value,
                   MIN(value) AS min_value,
                   MAX(value) AS max_value,
                   COUNT(*) AS sample_count,
                   MAX(sample_time) AS last_update
            FROM metric_samples
            WHERE sample_time >= NOW() - make_interval(mins => ?)
            GROUP BY component, metric_name
            ORDER BY component, metric_name
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> MetricSummary.builder()
                .component(Component.valueOf(rs.getString("component")))
                .metricName(rs.getString("metric_name"))
                .avgValue(rs.getDouble("avg_value"))
                .minValue(rs.getDouble("min_value"))
                .maxValue(rs.getDouble("max_value"))
                .sampleCount(rs.getLong("sample_count"))
                .lastUpdate(rs.getTimestamp("last_update").toInstant())
                .build(), lastMinutes);
    }

    @Override
    public int createPartitions(int daysAhead) {
        Integer created = jdbcTemplate.queryForObject(
                "SELECT create_metric_sample_partitions(?)", Integer.class, daysAhead);
        return created != null ? created : 0;
    }

    @Override
    public int dropPartitionsOlderThan(int retentionDays) {
        Integer dropped = jdbcTemplate.queryForObject(
                "SELECT drop_old_metric_sample_partitions(?)", Integer.class, retentionDays);
        return dropped != null ? dropped : 0;
    }

    @Override
    public List<Map<String, Object>> partitionStatistics() {
        return jdbcTemplate.queryForList(
                "SELECT * FROM get_metric_sample_partition_statistics() ORDER BY partition_name DESC");
    }

    private class MetricSampleRowMapper implements RowMapper<MetricSample> {
        @Override
        public MetricSample mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MetricSample.builder()
                    .timestamp(rs.getTimestamp("sample_time").toInstant())
                    .component(Component.valueOf(rs.getString("component")))
                    .metricName(rs.getString("metric_name"))
                    .value(rs.getDouble("value"))
                    .unit(rs.getString("unit"))
                    .host(rs.getString("host"))
                    .cluster(rs.getString("cluster"))
                    .environment(rs.getString("environment"))
                    .tags(jsonTags.read(rs.getString("tags")))
                    .build();
        }
    }
}
