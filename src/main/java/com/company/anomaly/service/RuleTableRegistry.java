package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.RuleTable;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule table. Readers take one immutable snapshot per sample;
 * a reload replaces the reference in a single step.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RuleTableRegistry {

    private final RuleTableLoader loader;
    private final AnomalyProperties properties;

    private final AtomicReference<RuleTable> active = new AtomicReference<>(RuleTable.EMPTY);

    @PostConstruct
    public void loadInitial() {
        RuleTable table = reload();
        log.info("Rule table {} active with {} tiers", table.getVersion(), table.size());
    }

    public RuleTable current() {
        return active.get();
    }

    /**
     * Reloads from the configured location. On failure the previous table stays active.
     */
    public RuleTable reload() {
        return reload(properties.getRules().getLocation());
    }

    public RuleTable reload(String location) {
        RuleTable table = loader.load(location);
        return swap(table);
    }

    public RuleTable swap(RuleTable table) {
        RuleTable previous = active.getAndSet(table);
        log.info("Rule table swapped: {} -> {} ({} tiers)",
                previous.getVersion(), table.getVersion(), table.size());
        return table;
    }
}
