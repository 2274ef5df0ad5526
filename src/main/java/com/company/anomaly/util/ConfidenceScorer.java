package com.company.anomaly.util;

/**
 * Incident confidence in [0, 1].
 * Weighted sum of three normalized factors, each clamped to [0, 1]:
 * lag tightness, hop count relative to the full chain, and share of critical events.
 * Non-negative weights keep the score non-decreasing in every factor.
 */
public class ConfidenceScorer {

    static final double LAG_WEIGHT = 0.4;
    static final double HOP_WEIGHT = 0.3;
    static final double SEVERITY_WEIGHT = 0.3;

    private ConfidenceScorer() {
    }

    /**
     * @param lagTightness  1 when hops are simultaneous, 0 at the maximum lag
     * @param hops          observed hops
     * @param maxHops       hops of a complete chain
     * @param criticalShare fraction of constituent events that are critical
     */
    public static double score(double lagTightness, int hops, int maxHops, double criticalShare) {
        double hopFactor = maxHops > 0 ? (double) hops / maxHops : 0.0;
        double raw = LAG_WEIGHT * clamp(lagTightness)
                + HOP_WEIGHT * clamp(hopFactor)
                + SEVERITY_WEIGHT * clamp(criticalShare);
        return clamp(Math.round(raw * 1000.0) / 1000.0);
    }

    /**
     * 1 - meanLag / maxLag
     */
    public static double lagTightness(double meanLagMillis, double maxLagMillis) {
        if (maxLagMillis <= 0) {
            return 1.0;
        }
        return clamp(1.0 - meanLagMillis / maxLagMillis);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
