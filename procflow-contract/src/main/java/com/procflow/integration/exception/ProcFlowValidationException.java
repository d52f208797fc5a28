package com.procflow.integration.exception;

import lombok.Getter;

import java.util.List;

/**
 * A definition or trigger input was rejected before any run was created. Never retried.
 */
@Getter
public class ProcFlowValidationException extends ProcFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ProcFlowValidationException(String message, List<String> errors) {
        super(message + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public static ProcFlowValidationException invalidDefinition(String definitionId, List<String> errors) {
        return new ProcFlowValidationException("Workflow definition " + definitionId + " is invalid", errors);
    }

    public static ProcFlowValidationException invalidTriggerInput(String definitionId, List<String> errors) {
        return new ProcFlowValidationException("Trigger input for workflow " + definitionId + " is invalid", errors);
    }
}
