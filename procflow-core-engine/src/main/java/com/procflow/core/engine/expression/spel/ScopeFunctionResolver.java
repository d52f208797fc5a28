package com.procflow.core.engine.expression.spel;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.engine.expression.functions.ExpressionFunctionRegistry;
import com.procflow.core.engine.expression.functions.IExpressionFunction;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves calls such as {@code daysBetween(a, b)} to the registered {@link IExpressionFunction}s.
 * Only calls on the scope itself resolve; any other name or target is reported by SpEL as an
 * unknown method.
 */
public class ScopeFunctionResolver implements MethodResolver {

    private final ExpressionFunctionRegistry functions;

    public ScopeFunctionResolver(ExpressionFunctionRegistry functions) {
        this.functions = functions;
    }

    @Override
    public MethodExecutor resolve(EvaluationContext context, Object targetObject, String name,
                                  List<TypeDescriptor> argumentTypes) {
        if (!(targetObject instanceof ExpressionScope)) {
            return null;
        }
        IExpressionFunction function = functions.getFunction(name);
        return function == null ? null : new FunctionExecutor(function);
    }

    private record FunctionExecutor(IExpressionFunction function) implements MethodExecutor {

        @Override
        public TypedValue execute(EvaluationContext context, Object target, Object... arguments) {
            ExpressionScope scope = (ExpressionScope) target;
            List<Object> values = new ArrayList<>(arguments.length);
            for (Object argument : arguments) {
                values.add(scope.unwrap(argument));
            }
            function.validate(values, scope);
            return new TypedValue(function.execute(values, scope));
        }
    }
}
