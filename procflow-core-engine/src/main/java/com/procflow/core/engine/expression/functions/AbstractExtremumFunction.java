package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared argument handling for {@code min} and {@code max}: either numbers as varargs
 * or a single list of numbers.
 */
abstract class AbstractExtremumFunction implements IExpressionFunction {

    protected abstract boolean prefer(int comparison);

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        List<Object> candidates = candidates(arguments);
        if (candidates.isEmpty()) {
            throw new InvalidExpressionFunctionInputException("Function requires at least one number", this, arguments, scope.getExpression());
        }
        for (Object candidate : candidates) {
            if (!(candidate instanceof Number)) {
                throw new InvalidExpressionFunctionInputException("Not a number: " + candidate, this, arguments, scope.getExpression());
            }
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        Object best = null;
        for (Object candidate : candidates(arguments)) {
            if (best == null || prefer(CastUtil.compareNumbers((Number) candidate, (Number) best))) {
                best = candidate;
            }
        }
        return best;
    }

    private static List<Object> candidates(List<Object> arguments) {
        if (arguments.size() == 1 && arguments.get(0) instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return arguments;
    }
}
