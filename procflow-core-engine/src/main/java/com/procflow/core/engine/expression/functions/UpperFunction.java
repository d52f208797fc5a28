package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;

import java.util.List;
import java.util.Locale;

public class UpperFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "upper";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "upper(extract.vendor_code)"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 1) {
            throw new InvalidExpressionFunctionInputException("Function requires single String parameter", this, arguments, scope.getExpression());
        }
        if (arguments.get(0) != null && !(arguments.get(0) instanceof String)) {
            throw new InvalidExpressionFunctionInputException("Argument must be a string", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        String value = (String) arguments.get(0);
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
