package com.procflow.core.exception;

import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import lombok.Getter;

/**
 * A node tried to overwrite a run variable with a different value. Variables are append-only,
 * so this always indicates an engine defect.
 */
@Getter
public class ProcFlowVariableConflictException extends ProcFlowEngineException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ProcFlowVariableConflictException(String runId, String key) {
        super(ProcFlowEngineErrorCodes.INTERNAL_ERROR,
                "variable '" + key + "' of run " + runId + " is already bound to a different value");
        this.key = key;
    }
}
