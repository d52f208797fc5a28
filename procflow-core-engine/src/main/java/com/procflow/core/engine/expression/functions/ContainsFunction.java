package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Substring test for strings, membership for lists and key lookup for maps.
 */
public class ContainsFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "contains";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "contains(extract.vendor_name, 'ACME')",
                "contains(extract.tags, 'urgent')"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a container and a value", this, arguments, scope.getExpression());
        }
        Object container = arguments.get(0);
        if (container != null && !(container instanceof String) && !(container instanceof Collection)
                && !(container instanceof Map)) {
            throw new InvalidExpressionFunctionInputException("First argument must be a string, list or map", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        Object container = arguments.get(0);
        Object item = arguments.get(1);
        if (container instanceof String text) {
            return text.contains(CastUtil.castAsString(item));
        } else if (container instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (CastUtil.valuesEqual(element, item)) {
                    return true;
                }
            }
            return false;
        } else if (container instanceof Map<?, ?> map) {
            return map.containsKey(CastUtil.castAsString(item));
        }
        return false;
    }
}
