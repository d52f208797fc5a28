package com.procflow.core.exception;

import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import com.procflow.integration.exception.ProcFlowRuntimeException;
import lombok.Getter;

/**
 * Engine-level failure carrying an error code with its HTTP mapping.
 */
@Getter
public class ProcFlowEngineException extends ProcFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    private final ProcFlowEngineErrorCodes errorInfo;

    public ProcFlowEngineException(ProcFlowEngineErrorCodes errorInfo, Object... templateArguments) {
        super(errorInfo.format(templateArguments));
        this.errorInfo = errorInfo;
    }

    public ProcFlowEngineException(ProcFlowEngineErrorCodes errorInfo, Throwable cause, Object... templateArguments) {
        super(errorInfo.format(templateArguments), cause);
        this.errorInfo = errorInfo;
    }

    public static ProcFlowEngineException runNotFound(String runId) {
        return new ProcFlowEngineException(ProcFlowEngineErrorCodes.RUN_NOT_FOUND, runId);
    }

    public static ProcFlowEngineException definitionNotFound(String definitionId, int version) {
        return new ProcFlowEngineException(ProcFlowEngineErrorCodes.DEFINITION_NOT_FOUND, definitionId, version);
    }
}
