package com.procflow.integration.enumerations;

/**
 * Status of a single step attempt.
 */
public enum ProcFlowStepStatus {

    /**
     * Opened but not yet closed. Only visible while an attempt is in flight
     * or when a walk was interrupted before closing it.
     */
    RUNNING,

    SUCCEEDED,

    FAILED,

    SKIPPED,

    SUSPENDED;

    /**
     * At most one attempt per node may end in a terminal status.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == SKIPPED;
    }
}
