package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.domain.RuleTier;
import com.company.anomaly.domain.enums.Comparison;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.exception.RuleTableLoadException;
import com.company.anomaly.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTableLoaderTest {

    private final RuleTableLoader loader = Fixtures.ruleTableLoader();

    @Test
    @DisplayName("Default rule table loads all tiers in authoring order")
    void loadsDefaultTable() {
        RuleTable table = loader.load(Fixtures.DEFAULT_RULES);

        assertEquals("2024.1", table.getVersion());
        assertEquals(15, table.size());

        List<RuleTier> lag = table.tiersFor(Component.BROKER, "consumer_lag");
        assertEquals(2, lag.size());
        assertEquals(Severity.CRITICAL, lag.get(0).getSeverity());
        assertEquals(100000.0, lag.get(0).getThreshold());
        assertEquals(Severity.WARNING, lag.get(1).getSeverity());

        RuleTier throughput = table.tiersFor(Component.STREAM_PROCESSOR, "task_throughput").get(0);
        assertEquals(Comparison.LESS_THAN, throughput.getComparison());
    }

    @Test
    @DisplayName("Every default group is authored most severe first")
    void defaultTableIsSeverityOrdered() {
        RuleTable table = loader.load(Fixtures.DEFAULT_RULES);

        for (RuleTier tier : table.allTiers()) {
            List<RuleTier> group = table.tiersFor(tier.getComponent(), tier.getMetricName());
            for (int i = 1; i < group.size(); i++) {
                assertFalse(group.get(i).getSeverity().isHigherThan(group.get(i - 1).getSeverity()),
                        tier.getComponent() + "/" + tier.getMetricName());
            }
        }
    }

    @Test
    @DisplayName("Load time is taken from the injected clock")
    void loadTimeFromClock() {
        Instant loadedAt = Instant.parse("2024-03-01T08:30:00Z");
        RuleTableLoader fixedLoader = Fixtures.ruleTableLoader(Clock.fixed(loadedAt, ZoneOffset.UTC));

        assertEquals(loadedAt, fixedLoader.load(Fixtures.DEFAULT_RULES).getLoadedAt());
    }

    @Test
    @DisplayName("Missing resource is a load failure")
    void missingResource() {
        assertThrows(RuleTableLoadException.class, () -> loader.load("classpath:rules/does-not-exist.json"));
    }

    @Test
    @DisplayName("Documents without a version or with unknown components are rejected")
    void rejectsInvalidDocuments() {
        RuleTableLoader.RuleTableDocument noVersion = document(null, tierDoc("broker", ">", "critical"));
        assertThrows(RuleTableLoadException.class, () -> loader.toRuleTable(noVersion, "test"));

        RuleTableLoader.RuleTableDocument badComponent = document("v1", tierDoc("zookeeper", ">", "critical"));
        RuleTableLoadException e = assertThrows(RuleTableLoadException.class,
                () -> loader.toRuleTable(badComponent, "test"));
        assertTrue(e.getMessage().contains("zookeeper"));

        RuleTableLoader.RuleTableDocument badComparison = document("v1", tierDoc("broker", ">=", "critical"));
        assertThrows(RuleTableLoadException.class, () -> loader.toRuleTable(badComparison, "test"));

        RuleTableLoader.RuleTableDocument badSeverity = document("v1", tierDoc("broker", ">", "fatal"));
        assertThrows(RuleTableLoadException.class, () -> loader.toRuleTable(badSeverity, "test"));
    }

    @Test
    @DisplayName("Misordered groups load unchanged")
    void doesNotReorder() {
        RuleTableLoader.TierDocument warning = tierDoc("broker", ">", "warning");
        warning.setThreshold(50000.0);
        RuleTableLoader.TierDocument critical = tierDoc("broker", ">", "critical");

        RuleTable table = loader.toRuleTable(document("v2", warning, critical), "test");

        List<RuleTier> group = table.tiersFor(Component.BROKER, "consumer_lag");
        assertEquals(Severity.WARNING, group.get(0).getSeverity());
        assertEquals(Severity.CRITICAL, group.get(1).getSeverity());
    }

    @Test
    @DisplayName("A failed reload keeps the active table")
    void failedReloadKeepsActiveTable() {
        RuleTableRegistry registry = new RuleTableRegistry(loader, new AnomalyProperties());
        registry.loadInitial();
        RuleTable before = registry.current();

        assertThrows(RuleTableLoadException.class, () -> registry.reload("classpath:rules/missing.json"));

        assertSame(before, registry.current());
        assertEquals("2024.1", registry.current().getVersion());
    }

    private RuleTableLoader.RuleTableDocument document(String version, RuleTableLoader.TierDocument... tiers) {
        RuleTableLoader.RuleTableDocument document = new RuleTableLoader.RuleTableDocument();
        document.setVersion(version);
        document.setTiers(List.of(tiers));
        return document;
    }

    private RuleTableLoader.TierDocument tierDoc(String component, String comparison, String severity) {
        RuleTableLoader.TierDocument tier = new RuleTableLoader.TierDocument();
        tier.setComponent(component);
        tier.setMetric("consumer_lag");
        tier.setComparison(comparison);
        tier.setThreshold(100000.0);
        tier.setSeverity(severity);
        return tier;
    }
}
