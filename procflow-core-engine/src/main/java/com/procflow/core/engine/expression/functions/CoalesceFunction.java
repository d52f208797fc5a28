package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;

import java.util.List;

public class CoalesceFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "coalesce";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "coalesce(extract.po_number, 'N/A')"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.isEmpty()) {
            throw new InvalidExpressionFunctionInputException("Function requires at least one argument", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        for (Object argument : arguments) {
            if (argument != null) {
                return argument;
            }
        }
        return null;
    }
}
