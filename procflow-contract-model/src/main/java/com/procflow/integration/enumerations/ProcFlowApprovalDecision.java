package com.procflow.integration.enumerations;

public enum ProcFlowApprovalDecision {
    APPROVED,
    REJECTED,
    EDITED
}
