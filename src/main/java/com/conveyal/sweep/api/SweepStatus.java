package com.conveyal.sweep.api;

/**
 * Sweep-level outcome. Per-candidate problems never appear here, only in the probe trace.
 */
public enum SweepStatus {
    OK,
    GEOCODE_FAILED,
    SWEEP_EMPTY
}
