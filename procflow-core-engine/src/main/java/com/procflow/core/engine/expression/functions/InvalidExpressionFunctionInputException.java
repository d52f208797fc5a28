package com.procflow.core.engine.expression.functions;

import com.procflow.integration.exception.ProcFlowExpressionException;

import java.util.List;

public class InvalidExpressionFunctionInputException extends ProcFlowExpressionException {

    private static final long serialVersionUID = 1L;

    public InvalidExpressionFunctionInputException(String message, IExpressionFunction function,
                                                   List<Object> arguments, String expression) {
        super(
                Reason.TYPE_MISMATCH,
                String.format(
                        "[%s] invalid input for function %s. Arguments : %s, Sample usage : %s",
                        message,
                        function.getName(),
                        arguments,
                        function.getSampleUsage()
                ),
                expression
        );
    }
}
