package com.procflow.integration.enumerations;

/**
 * What happens to an open approval once its deadline has passed.
 */
public enum ProcFlowApprovalTimeoutAction {
    /**
     * The approval node fails with {@code TIMEOUT}.
     */
    FAIL,
    /**
     * The approval is resumed as approved by the engine.
     */
    AUTO_APPROVE;

    public static ProcFlowApprovalTimeoutAction fromConfig(Object value) {
        if (value == null || String.valueOf(value).isBlank()) {
            return FAIL;
        }
        String name = String.valueOf(value).trim().toUpperCase().replace('-', '_');
        if ("APPROVE".equals(name)) {
            return AUTO_APPROVE;
        }
        return valueOf(name);
    }
}
