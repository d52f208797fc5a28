package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;

import java.util.List;

public class ConcatFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "concat";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "concat(extract.vendor_name, ' - ', extract.invoice_number)"
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
        StringBuilder builder = new StringBuilder();
        for (Object argument : arguments) {
            builder.append(CastUtil.castAsString(argument));
        }
        return builder.toString();
    }
}
