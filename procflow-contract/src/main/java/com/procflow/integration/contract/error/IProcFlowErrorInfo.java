package com.procflow.integration.contract.error;

public interface IProcFlowErrorInfo {
    String getErrorCode();
    ProcFlowHttpStatus getHttpStatus();
    String getErrorTemplate();
}
