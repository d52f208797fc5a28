package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public class LengthFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "length";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "length(extract.line_items)",
                "length(trigger_comment)"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 1) {
            throw new InvalidExpressionFunctionInputException("Function requires single parameter", this, arguments, scope.getExpression());
        }
        Object value = arguments.get(0);
        if (value != null && !(value instanceof CharSequence) && !(value instanceof Collection)
                && !(value instanceof Map)) {
            throw new InvalidExpressionFunctionInputException("Argument must be a string, list or map", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        Object value = arguments.get(0);
        if (value instanceof CharSequence text) {
            return (long) text.length();
        } else if (value instanceof Collection<?> collection) {
            return (long) collection.size();
        } else if (value instanceof Map<?, ?> map) {
            return (long) map.size();
        }
        return 0L;
    }
}
