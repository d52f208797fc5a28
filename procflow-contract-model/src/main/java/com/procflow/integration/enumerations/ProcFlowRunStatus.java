package com.procflow.integration.enumerations;

/**
 * Lifecycle status of a workflow run.
 *
 * <pre>
 * RUNNING ──→ SUSPENDED ──→ RUNNING ──→ COMPLETED | FAILED | CANCELLED
 * </pre>
 */
public enum ProcFlowRunStatus {

    /**
     * The run has runnable frontier nodes or is being walked.
     */
    RUNNING,

    /**
     * Nothing is runnable and at least one approval is open.
     */
    SUSPENDED,

    COMPLETED,

    FAILED,

    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
