package com.company.anomaly.util;

import lombok.Getter;

/**
 * Welford incremental mean/variance with min/max.
 * Not thread-safe; callers serialize updates per bucket.
 */
@Getter
public class RunningStats {

    private long count;
    private double mean;
    private double m2;
    private double min = Double.NaN;
    private double max = Double.NaN;

    public RunningStats() {
    }

    private RunningStats(long count, double mean, double m2, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
        this.min = min;
        this.max = max;
    }

    public static RunningStats resume(long count, double mean, double m2, double min, double max) {
        if (count == 0) {
            return new RunningStats();
        }
        return new RunningStats(count, mean, m2, min, max);
    }

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);

        if (count == 1) {
            min = value;
            max = value;
        } else {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
    }

    public RunningStats copy() {
        return new RunningStats(count, mean, m2, min, max);
    }

    /**
     * Sample standard deviation (n - 1), 0 below two samples
     */
    public double stddev() {
        return count > 1 ? Math.sqrt(m2 / (count - 1)) : 0.0;
    }
}
