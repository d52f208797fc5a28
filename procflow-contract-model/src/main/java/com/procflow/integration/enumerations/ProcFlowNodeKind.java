package com.procflow.integration.enumerations;

import java.util.EnumSet;
import java.util.Set;

/**
 * The closed set of node kinds a workflow definition may declare.
 * Every kind must have exactly one registered executor.
 */
public enum ProcFlowNodeKind {

    /**
     * Entry point. Exactly one per definition.
     */
    START,

    /**
     * Exit point. Collects the run output.
     */
    END,

    /**
     * Routes to the first outgoing edge whose condition is truthy.
     */
    DECISION,

    /**
     * Fans out to every outgoing edge concurrently.
     */
    FORK,

    /**
     * Synchronization point for forked branches.
     */
    JOIN,

    /**
     * Structured extraction through the external LLM adapter.
     */
    AI_EXTRACTION,

    /**
     * Human-in-the-loop review. Suspends the branch until a decision arrives.
     */
    APPROVAL,

    FILE_OPERATION,
    DOCUMENT_GENERATION,
    NOTIFICATION,
    API_CALL;

    private static final Set<ProcFlowNodeKind> ACTIONS =
            EnumSet.of(FILE_OPERATION, DOCUMENT_GENERATION, NOTIFICATION, API_CALL);

    /**
     * Whether this kind delegates a side effect to an action provider.
     */
    public boolean isAction() {
        return ACTIONS.contains(this);
    }
}
