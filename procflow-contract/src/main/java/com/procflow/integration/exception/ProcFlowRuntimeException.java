package com.procflow.integration.exception;

public class ProcFlowRuntimeException extends RuntimeException {
    public ProcFlowRuntimeException(String message) {
        super(message);
    }
    public ProcFlowRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public ProcFlowRuntimeException(Throwable cause) {
        super(cause);
    }
}
