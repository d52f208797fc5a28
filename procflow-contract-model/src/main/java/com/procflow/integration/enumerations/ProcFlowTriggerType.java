package com.procflow.integration.enumerations;

/**
 * How a run is started. Only {@link #MANUAL} is operational; the other
 * types are accepted in definitions but never fire.
 */
public enum ProcFlowTriggerType {
    MANUAL,
    SCHEDULE,
    WEBHOOK
}
