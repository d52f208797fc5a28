package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Rounds half-up. Without a scale the result is a whole number.
 */
public class RoundFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "round";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "round(extract.total_amount)",
                "round(extract.total_amount * 1.2, 2)"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a number and an optional scale", this, arguments, scope.getExpression());
        }
        if (!(arguments.get(0) instanceof Number)) {
            throw new InvalidExpressionFunctionInputException("First argument must be a number", this, arguments, scope.getExpression());
        }
        if (arguments.size() == 2 && !CastUtil.isIntegral(arguments.get(1))) {
            throw new InvalidExpressionFunctionInputException("Scale must be an integer", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        Number value = (Number) arguments.get(0);
        if (CastUtil.isIntegral(value)) {
            return value.longValue();
        }
        int scale = arguments.size() == 2 ? (int) CastUtil.castAsLong(arguments.get(1)) : 0;
        BigDecimal rounded = BigDecimal.valueOf(value.doubleValue()).setScale(scale, RoundingMode.HALF_UP);
        return scale <= 0 ? (Object) rounded.longValue() : (Object) rounded.doubleValue();
    }
}
