package com.procflow.core.engine.expression.spel;

import com.procflow.core.engine.expression.ExpressionScope;
import com.procflow.core.util.CastUtil;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.TypeConverter;
import org.springframework.expression.spel.support.StandardTypeConverter;

/**
 * Applies the engine's truthiness rules wherever SpEL needs a boolean ({@code &&}, {@code ||},
 * {@code !}, {@code ?:}) and its number formatting wherever it needs a string. Other
 * conversions go to the standard converter.
 */
public class TruthinessTypeConverter implements TypeConverter {

    private final StandardTypeConverter delegate = new StandardTypeConverter();

    @Override
    public boolean canConvert(TypeDescriptor sourceType, TypeDescriptor targetType) {
        return isBoolean(targetType) || isString(targetType) || delegate.canConvert(sourceType, targetType);
    }

    @Override
    public Object convertValue(Object value, TypeDescriptor sourceType, TypeDescriptor targetType) {
        Object resolved = value instanceof ExpressionScope.Namespace namespace ? namespace.value() : value;
        if (isBoolean(targetType)) {
            return CastUtil.isTruthy(resolved);
        }
        if (isString(targetType) && resolved != null && !(resolved instanceof String)) {
            return CastUtil.castAsString(resolved);
        }
        return delegate.convertValue(resolved, resolved == null ? sourceType : TypeDescriptor.forObject(resolved), targetType);
    }

    private static boolean isBoolean(TypeDescriptor type) {
        return type.getType() == Boolean.class || type.getType() == boolean.class;
    }

    private static boolean isString(TypeDescriptor type) {
        return type.getType() == String.class;
    }
}
