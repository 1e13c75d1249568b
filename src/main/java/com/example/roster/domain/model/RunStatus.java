package com.example.roster.domain.model;

/**
 * Outcome of one extraction run. Degraded runs still carry their data but signal structural anomalies.
 */
public enum RunStatus {
    SUCCESS,
    DEGRADED
}
