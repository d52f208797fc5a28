package com.procflow.integration.enumerations;

public enum ProcFlowRunEventType {
    RUN_STARTED,
    STEP_STARTED,
    STEP_SUCCEEDED,
    STEP_FAILED,
    STEP_SKIPPED,
    STEP_SUSPENDED,
    RUN_SUSPENDED,
    RUN_RESUMED,
    APPROVAL_RECORDED,
    APPROVAL_ESCALATED,
    RUN_COMPLETED,
    RUN_FAILED,
    RUN_CANCELLED
}
