package com.company.anomaly.service;

public enum RollupOutcome {
    MERGED,
    /** Arrived beyond the maximum lateness; stored raw but not rolled up */
    SKIPPED_LATE
}
