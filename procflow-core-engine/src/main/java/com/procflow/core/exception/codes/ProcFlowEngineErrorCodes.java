package com.procflow.core.exception.codes;

import com.procflow.integration.contract.error.IProcFlowErrorInfo;
import com.procflow.integration.contract.error.ProcFlowHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ProcFlowEngineErrorCodes implements IProcFlowErrorInfo {

    RUN_NOT_FOUND(
            "PROCFLOW_ERR_0001",
            ProcFlowHttpStatus.NOT_FOUND,
            "Workflow run not found: %s"
    ),

    DEFINITION_NOT_FOUND(
            "PROCFLOW_ERR_0002",
            ProcFlowHttpStatus.NOT_FOUND,
            "Workflow definition not found: %s (version %s)"
    ),

    DEFINITION_INVALID(
            "PROCFLOW_ERR_0003",
            ProcFlowHttpStatus.BAD_REQUEST,
            "Workflow definition is invalid: %s"
    ),

    TRIGGER_INPUT_INVALID(
            "PROCFLOW_ERR_0004",
            ProcFlowHttpStatus.BAD_REQUEST,
            "Trigger input is invalid: %s"
    ),

    RUN_LOCKED(
            "PROCFLOW_ERR_0005",
            ProcFlowHttpStatus.CONFLICT,
            "Workflow run is being advanced elsewhere: %s"
    ),

    EXECUTOR_REGISTRATION_INVALID(
            "PROCFLOW_ERR_0006",
            ProcFlowHttpStatus.INTERNAL_SERVER_ERROR,
            "Node executor registration is invalid: %s"
    ),

    INTERNAL_ERROR(
            "PROCFLOW_ERR_0007",
            ProcFlowHttpStatus.INTERNAL_SERVER_ERROR,
            "Internal engine error: %s"
    ),

    RUN_ALREADY_EXISTS(
            "PROCFLOW_ERR_0008",
            ProcFlowHttpStatus.CONFLICT,
            "Workflow run already exists: %s"
    )

    ;

    private final String errorCode;
    private final ProcFlowHttpStatus httpStatus;
    private final String errorTemplate;

    public String format(Object... arguments) {
        return String.format(errorTemplate, arguments);
    }
}
