package com.company.anomaly.config;

import com.company.anomaly.domain.enums.Granularity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engine tuning, bound from the "anomaly" prefix
 */
@Data
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    private Rules rules = new Rules();
    private Rollup rollup = new Rollup();
    private Correlation correlation = new Correlation();
    private Resolution resolution = new Resolution();
    private Executor executor = new Executor();
    private Partitions partitions = new Partitions();

    @Data
    public static class Rules {
        /** Spring resource location of the rule table JSON */
        private String location = "classpath:rules/default-rules.json";
    }

    @Data
    public static class Rollup {
        private Set<Granularity> granularities = EnumSet.allOf(Granularity.class);
        /** Time after bucket end during which a bucket stays provisional */
        private Duration grace = Duration.ofMinutes(2);
        /** Samples arriving later than this after their timestamp skip rollups */
        private Duration maxLateness = Duration.ofMinutes(5);
    }

    @Data
    public static class Correlation {
        private Duration window = Duration.ofMinutes(15);
        private Duration maxLag = Duration.ofMinutes(5);
        private Duration maxCatchUp = Duration.ofHours(6);
        private Duration exhaustionBucket = Duration.ofMinutes(5);
        private int minExhaustionMetrics = 3;
    }

    @Data
    public static class Resolution {
        private Duration warningExpiry = Duration.ofMinutes(5);
        private Duration criticalExpiry = Duration.ofMinutes(10);
        private int batchSize = 500;
    }

    @Data
    public static class Executor {
        private int evaluationThreads = 4;
        private int rollupThreads = 4;
        private int queueCapacity = 10000;
    }

    @Data
    public static class Partitions {
        private int daysAhead = 7;
        /** Raw samples only; anomaly events are kept indefinitely */
        private int retentionDays = 30;
    }
}
