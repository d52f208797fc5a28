package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;

import java.util.List;

/**
 * Built-in function callable from expressions. Functions must be pure.
 */
public interface IExpressionFunction {

    String getName();

    List<String> getSampleUsage();

    void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException;

    Object execute(List<Object> arguments, ExpressionScope scope);
}
