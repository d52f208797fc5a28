package com.procflow.core.engine.expression.spel;

import com.procflow.core.engine.expression.ExpressionScope;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

/**
 * The only property accessor of the evaluation context. Names are resolved against the flat
 * variable scope and then navigated through maps and file references; reflection is never used.
 */
public class ScopePropertyAccessor implements PropertyAccessor {

    @Override
    public Class<?>[] getSpecificTargetClasses() {
        return null;
    }

    @Override
    public boolean canRead(EvaluationContext context, Object target, String name) {
        return target != null;
    }

    @Override
    public TypedValue read(EvaluationContext context, Object target, String name) {
        if (target instanceof ExpressionScope scope) {
            return new TypedValue(scope.resolveRoot(name));
        }
        if (target instanceof ExpressionScope.Namespace namespace) {
            return new TypedValue(namespace.scope().resolveMember(namespace, name));
        }
        ExpressionScope scope = (ExpressionScope) context.getRootObject().getValue();
        return new TypedValue(scope.resolveMember(target, name));
    }

    @Override
    public boolean canWrite(EvaluationContext context, Object target, String name) {
        return false;
    }

    @Override
    public void write(EvaluationContext context, Object target, String name, Object newValue) {
        throw new UnsupportedOperationException("Expressions are read-only");
    }
}
