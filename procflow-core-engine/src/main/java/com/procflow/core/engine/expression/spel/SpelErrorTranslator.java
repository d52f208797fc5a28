package com.procflow.core.engine.expression.spel;

import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.exception.ProcFlowExpressionException.Reason;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.spel.SpelEvaluationException;
import org.springframework.expression.spel.SpelMessage;
import org.springframework.expression.spel.SpelParseException;

import java.time.DateTimeException;

/**
 * Maps SpEL parse and evaluation failures onto {@link ProcFlowExpressionException} reasons.
 */
public final class SpelErrorTranslator {

    private SpelErrorTranslator() {}

    public static ProcFlowExpressionException translate(RuntimeException error, String expression) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof ProcFlowExpressionException expressionError) {
                return expressionError;
            }
            if (cause instanceof ArithmeticException arithmetic) {
                return arithmetic(arithmetic, expression);
            }
        }
        if (error instanceof SpelParseException parse) {
            Reason reason = parse.getMessageCode() == SpelMessage.MAX_EXPRESSION_LENGTH_EXCEEDED
                    ? Reason.LIMIT_EXCEEDED : Reason.SYNTAX;
            return new ProcFlowExpressionException(reason, parse.getSimpleMessage(), expression);
        }
        if (error instanceof SpelEvaluationException evaluation) {
            return evaluation(evaluation, expression);
        }
        if (error instanceof ExpressionException || error instanceof ClassCastException
                || error instanceof DateTimeException || error instanceof IllegalArgumentException) {
            return ProcFlowExpressionException.typeMismatch(error.getMessage(), expression);
        }
        throw error;
    }

    private static ProcFlowExpressionException evaluation(SpelEvaluationException error, String expression) {
        SpelMessage code = error.getMessageCode();
        Object[] inserts = error.getInserts();
        String message = error.getSimpleMessage();
        switch (code) {
            case PROPERTY_OR_FIELD_NOT_READABLE:
            case PROPERTY_OR_FIELD_NOT_READABLE_ON_NULL:
                String identifier = inserts != null && inserts.length > 0 ? String.valueOf(inserts[0]) : null;
                return new ProcFlowExpressionException(Reason.UNKNOWN_IDENTIFIER, message, expression, identifier);
            case METHOD_NOT_FOUND:
            case FUNCTION_NOT_DEFINED:
                return new ProcFlowExpressionException(Reason.UNKNOWN_FUNCTION, message, expression);
            default:
                break;
        }
        if (code.name().endsWith("_INDEX_OUT_OF_BOUNDS")) {
            return new ProcFlowExpressionException(Reason.UNKNOWN_IDENTIFIER, message, expression);
        }
        if (code.name().startsWith("MAX_")) {
            return new ProcFlowExpressionException(Reason.LIMIT_EXCEEDED, message, expression);
        }
        return ProcFlowExpressionException.typeMismatch(message, expression);
    }

    private static ProcFlowExpressionException arithmetic(ArithmeticException error, String expression) {
        String message = String.valueOf(error.getMessage()).toLowerCase();
        if (message.contains("zero") || message.contains("undefined")) {
            return new ProcFlowExpressionException(Reason.DIVISION_BY_ZERO, "division by zero", expression);
        }
        return ProcFlowExpressionException.typeMismatch(error.getMessage(), expression);
    }
}
