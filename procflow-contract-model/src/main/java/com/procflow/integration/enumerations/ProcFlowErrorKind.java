package com.procflow.integration.enumerations;

/**
 * Classification of node and run level failures.
 */
public enum ProcFlowErrorKind {

    /**
     * Bad definition, bad trigger input or bad node configuration.
     */
    VALIDATION,

    /**
     * A derived-value or condition expression could not be evaluated.
     */
    EXPRESSION,

    /**
     * An external collaborator failed.
     */
    UPSTREAM,

    /**
     * A decision node found no truthy condition and no default edge.
     */
    NO_MATCHING_BRANCH,

    /**
     * A reviewer rejected an approval.
     */
    REJECTED_BY_REVIEWER,

    /**
     * A step exceeded its timeout.
     */
    TIMEOUT,

    /**
     * The run exceeded the configured number of node executions.
     */
    STEP_LIMIT_EXCEEDED,

    /**
     * A join node can no longer receive all of its expected arrivals.
     */
    JOIN_UNSATISFIED,

    /**
     * The run was cancelled while the step was pending.
     */
    CANCELLED,

    /**
     * Engine defect or interrupted attempt.
     */
    INTERNAL
}
