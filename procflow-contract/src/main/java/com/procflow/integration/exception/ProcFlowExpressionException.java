package com.procflow.integration.exception;

import lombok.Getter;

/**
 * An expression could not be parsed or evaluated against its scope.
 */
@Getter
public class ProcFlowExpressionException extends ProcFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        UNKNOWN_IDENTIFIER,
        UNKNOWN_FUNCTION,
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        SYNTAX,
        LIMIT_EXCEEDED
    }

    private final Reason reason;
    private final String expression;

    /**
     * The unresolved path for {@link Reason#UNKNOWN_IDENTIFIER}, otherwise null.
     */
    private final String identifier;

    public ProcFlowExpressionException(Reason reason, String message, String expression, String identifier) {
        super(String.format("%s: %s (expression: %s)", reason, message, expression));
        this.reason = reason;
        this.expression = expression;
        this.identifier = identifier;
    }

    public ProcFlowExpressionException(Reason reason, String message, String expression) {
        this(reason, message, expression, null);
    }

    public static ProcFlowExpressionException unknownIdentifier(String identifier, String expression) {
        return new ProcFlowExpressionException(Reason.UNKNOWN_IDENTIFIER,
                "unknown identifier '" + identifier + "'", expression, identifier);
    }

    public static ProcFlowExpressionException typeMismatch(String message, String expression) {
        return new ProcFlowExpressionException(Reason.TYPE_MISMATCH, message, expression);
    }

    /**
     * Root namespace of the unresolved identifier, i.e. the part before the first dot.
     */
    public String getIdentifierRoot() {
        if (identifier == null) {
            return null;
        }
        int dot = identifier.indexOf('.');
        return dot < 0 ? identifier : identifier.substring(0, dot);
    }
}
