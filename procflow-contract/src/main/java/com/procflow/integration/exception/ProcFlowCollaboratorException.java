package com.procflow.integration.exception;

import lombok.Getter;

/**
 * Raised by external collaborators. A {@code permanent} failure is never retried.
 */
@Getter
public class ProcFlowCollaboratorException extends ProcFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean permanent;

    public ProcFlowCollaboratorException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public ProcFlowCollaboratorException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public static ProcFlowCollaboratorException permanent(String message) {
        return new ProcFlowCollaboratorException(message, true);
    }

    public static ProcFlowCollaboratorException transientFailure(String message) {
        return new ProcFlowCollaboratorException(message, false);
    }
}
