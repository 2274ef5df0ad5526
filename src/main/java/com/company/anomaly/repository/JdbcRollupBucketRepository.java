package com.company.anomaly.repository;

import com.company.anomaly.domain.RollupBucket;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcRollupBucketRepository implements RollupBucketRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT granularity, bucket_start, component, metric_name,
               avg_value, min_value, max_value, stddev_value, m2, sample_count,
               provisional_until, updated_at
        FROM rollup_buckets
        """;

    /**
     * The engine holds the bucket's lock while calling this, so the row always
     * reflects the latest merged state.
     */
    @Override
    public void upsert(RollupBucket bucket) {
        String sql = """
            INSERT INTO rollup_buckets (
                granularity, bucket_start, component, metric_name,
                avg_value, min_value, max_value, stddev_value, m2, sample_count,
                provisional_until, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (granularity, component, metric_name, bucket_start)
            DO UPDATE SET
                avg_value = EXCLUDED.avg_value,
                min_value = EXCLUDED.min_value,
                max_value = EXCLUDED.max_value,
                stddev_value = EXCLUDED.stddev_value,
                m2 = EXCLUDED.m2,
                sample_count = EXCLUDED.sample_count,
                provisional_until = EXCLUDED.provisional_until,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcTemplate.update(sql,
                bucket.getGranularity().name(),
                Timestamp.from(bucket.getBucketStart()),
                bucket.getComponent().name(),
                bucket.getMetricName(),
                bucket.getAvg(),
                bucket.getMin(),
                bucket.getMax(),
                bucket.getStddev(),
                bucket.getM2(),
                bucket.getSampleCount(),
                Timestamp.from(bucket.getProvisionalUntil()),
                Timestamp.from(bucket.getUpdatedAt())
        );
    }

    @Override
    public Optional<RollupBucket> find(Granularity granularity, Component component,
                                       String metricName, Instant bucketStart) {
        String sql = SELECT_BASE + """
            WHERE granularity = ? AND component = ? AND metric_name = ? AND bucket_start = ?
            """;

        List<RollupBucket> rows = jdbcTemplate.query(sql, new RollupBucketRowMapper(),
                granularity.name(), component.name(), metricName, Timestamp.from(bucketStart));
        return rows.stream().findFirst();
    }

    @Override
    public List<RollupBucket> findRange(Granularity granularity, Component component, String metricName,
                                        Instant from, Instant to) {
        String sql = SELECT_BASE + """
            WHERE granularity = ? AND component = ? AND metric_name = ?
            AND bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start ASC
            """;

        return jdbcTemplate.query(sql, new RollupBucketRowMapper(),
                granularity.name(), component.name(), metricName,
                Timestamp.from(from), Timestamp.from(to));
    }

    private static class RollupBucketRowMapper implements RowMapper<RollupBucket> {
        @Override
        public RollupBucket mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RollupBucket.builder()
                    .granularity(Granularity.valueOf(rs.getString("granularity")))
                    .bucketStart(rs.getTimestamp("bucket_start").toInstant())
                    .component(Component.valueOf(rs.getString("component")))
                    .metricName(rs.getString("metric_name"))
                    .avg(rs.getDouble("avg_value"))
                    .min(rs.getDouble("min_value"))
                    .max(rs.getDouble("max_value"))
                    .stddev(rs.getDouble("stddev_value"))
                    .m2(rs.getDouble("m2"))
                    .sampleCount(rs.getLong("sample_count"))
                    .provisionalUntil(rs.getTimestamp("provisional_until").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
