package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.util.List;

/**
 * Returns the shifted date as an ISO {@code yyyy-MM-dd} string.
 */
public class AddDaysFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "addDays";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "addDays(extract.invoice_date, 30)",
                "addDays('2024-01-01', -1)"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a date and a day count", this, arguments, scope.getExpression());
        }
        if (CastUtil.castAsLocalDate(arguments.get(0)) == null) {
            throw new InvalidExpressionFunctionInputException("Not a date: " + arguments.get(0), this, arguments, scope.getExpression());
        }
        if (!CastUtil.isIntegral(arguments.get(1))) {
            throw new InvalidExpressionFunctionInputException("Day count must be an integer", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        return CastUtil.castAsLocalDate(arguments.get(0))
                .plusDays(CastUtil.castAsLong(arguments.get(1)))
                .toString();
    }
}
