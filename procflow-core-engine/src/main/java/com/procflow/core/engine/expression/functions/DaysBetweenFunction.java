package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.time.temporal.ChronoUnit;
import java.util.List;

public class DaysBetweenFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "daysBetween";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "daysBetween(extract.invoice_date, extract.due_date)",
                "daysBetween('2024-01-01', '2024-01-31')"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires two dates", this, arguments, scope.getExpression());
        }
        for (Object argument : arguments) {
            if (CastUtil.castAsLocalDate(argument) == null) {
                throw new InvalidExpressionFunctionInputException("Not a date: " + argument, this, arguments, scope.getExpression());
            }
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        return ChronoUnit.DAYS.between(
                CastUtil.castAsLocalDate(arguments.get(0)),
                CastUtil.castAsLocalDate(arguments.get(1)));
    }
}
