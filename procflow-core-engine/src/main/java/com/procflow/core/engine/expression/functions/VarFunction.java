package com.procflow.core.engine.expression.functions;

import com.procflow.core.engine.expression.ExpressionScope;

import java.util.List;

/**
 * Looks a variable up by its dotted name. Needed for node ids that are not plain identifiers,
 * e.g. {@code var('manager-approval.decision')}. With a second argument, an undefined variable
 * yields that default instead of an error.
 */
public class VarFunction implements IExpressionFunction {

    @Override
    public String getName() {
        return "var";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "var('manager-approval.decision')",
                "var('extract.po_number', 'N/A')"
        );
    }

    @Override
    public void validate(List<Object> arguments, ExpressionScope scope) throws InvalidExpressionFunctionInputException {
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a variable name and an optional default", this, arguments, scope.getExpression());
        }
        if (!(arguments.get(0) instanceof String name) || name.isBlank()) {
            throw new InvalidExpressionFunctionInputException("Variable name must be a non-empty string", this, arguments, scope.getExpression());
        }
    }

    @Override
    public Object execute(List<Object> arguments, ExpressionScope scope) {
        String name = (String) arguments.get(0);
        if (arguments.size() == 2 && !scope.isDefined(name)) {
            return arguments.get(1);
        }
        return scope.lookup(name);
    }
}
