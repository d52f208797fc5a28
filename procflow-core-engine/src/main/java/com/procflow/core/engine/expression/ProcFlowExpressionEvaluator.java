package com.procflow.core.engine.expression;

import com.procflow.core.engine.expression.functions.ExpressionFunctionRegistry;
import com.procflow.core.engine.expression.spel.ExpressionGuard;
import com.procflow.core.engine.expression.spel.ScopeFunctionResolver;
import com.procflow.core.engine.expression.spel.ScopePropertyAccessor;
import com.procflow.core.engine.expression.spel.SpelErrorTranslator;
import com.procflow.core.engine.expression.spel.TruthinessTypeConverter;
import com.procflow.core.util.CastUtil;
import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.exception.ProcFlowExpressionException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.spel.SpelCompilerMode;
import org.springframework.expression.spel.SpelParserConfiguration;
import org.springframework.expression.spel.standard.SpelExpression;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SpEL based evaluator for derived values and edge conditions: literals, dotted variable paths,
 * arithmetic, comparison, boolean logic and a fixed set of pure functions.
 *
 * <p>Expressions run in a {@link SimpleEvaluationContext} whose only property accessor reads
 * the variable scope and whose only method resolver calls registered functions, so there is no
 * reflection, no type access and no bean access. Parsed expressions are cached per text.</p>
 */
@Slf4j
public class ProcFlowExpressionEvaluator implements IProcFlowExpressionEvaluator {

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_MAX_LENGTH = 4096;

    private static final int MAX_CACHED_EXPRESSIONS = 2048;
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.+?)}}", Pattern.DOTALL);
    private static final Pattern SINGLE_PLACEHOLDER = Pattern.compile("^\\s*\\{\\{((?:(?!}}).)+)}}\\s*$", Pattern.DOTALL);

    private final SpelExpressionParser parser;
    private final ExpressionGuard guard;
    private final ScopePropertyAccessor propertyAccessor = new ScopePropertyAccessor();
    private final ScopeFunctionResolver functionResolver;
    private final TruthinessTypeConverter typeConverter = new TruthinessTypeConverter();
    private final Map<String, SpelExpression> parsed = new ConcurrentHashMap<>();

    public ProcFlowExpressionEvaluator(int maxDepth, int maxLength) {
        ExpressionFunctionRegistry functions = ExpressionFunctionRegistry.getInstance();
        this.parser = new SpelExpressionParser(
                new SpelParserConfiguration(SpelCompilerMode.OFF, null, false, false, 0, maxLength));
        this.guard = new ExpressionGuard(functions, maxDepth);
        this.functionResolver = new ScopeFunctionResolver(functions);
    }

    public static ProcFlowExpressionEvaluator getInstance() {
        return SingletonHelper.INSTANCE;
    }

    private static final class SingletonHelper {
        private static final ProcFlowExpressionEvaluator INSTANCE =
                new ProcFlowExpressionEvaluator(DEFAULT_MAX_DEPTH, DEFAULT_MAX_LENGTH);
    }

    @Override
    public Object evaluate(String expression, Map<String, Object> scope) {
        SpelExpression parsedExpression = parse(expression);
        ExpressionScope root = new ExpressionScope(scope, expression);
        EvaluationContext context = SimpleEvaluationContext.forPropertyAccessors(propertyAccessor)
                .withMethodResolvers(functionResolver)
                .withTypeConverter(typeConverter)
                .withRootObject(root)
                .build();
        Object result;
        try {
            result = root.unwrap(parsedExpression.getValue(context));
        } catch (RuntimeException e) {
            throw SpelErrorTranslator.translate(e, expression);
        }
        if (result instanceof Double || result instanceof Float) {
            double number = ((Number) result).doubleValue();
            if (Double.isInfinite(number) || Double.isNaN(number)) {
                throw new ProcFlowExpressionException(Reason.DIVISION_BY_ZERO, "result is not a finite number", expression);
            }
        }
        log.trace("Evaluated expression. expression={}, result={}", expression, result);
        return result;
    }

    @Override
    public boolean evaluateCondition(String expression, Map<String, Object> scope) {
        return CastUtil.isTruthy(evaluate(expression, scope));
    }

    @Override
    public String interpolate(String template, Map<String, Object> scope) {
        if (template == null || !template.contains("{{")) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = evaluate(matcher.group(1).trim(), scope);
            matcher.appendReplacement(result, Matcher.quoteReplacement(CastUtil.castAsString(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public Object interpolateValue(Object value, Map<String, Object> scope) {
        if (value instanceof String template) {
            Matcher single = SINGLE_PLACEHOLDER.matcher(template);
            if (single.matches()) {
                return evaluate(single.group(1).trim(), scope);
            }
            return interpolate(template, scope);
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, item) -> result.put(String.valueOf(key), interpolateValue(item, scope)));
            return result;
        } else if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(item -> result.add(interpolateValue(item, scope)));
            return result;
        }
        return value;
    }

    @Override
    public void validateSyntax(String expression) {
        parse(expression);
    }

    private SpelExpression parse(String expression) {
        guard.checkText(expression);
        SpelExpression cached = parsed.get(expression);
        if (cached != null) {
            return cached;
        }
        SpelExpression parsedExpression;
        try {
            parsedExpression = parser.parseRaw(expression);
        } catch (RuntimeException e) {
            throw SpelErrorTranslator.translate(e, expression);
        }
        guard.checkTree(parsedExpression.getAST(), expression);
        if (parsed.size() >= MAX_CACHED_EXPRESSIONS) {
            parsed.clear();
        }
        parsed.put(expression, parsedExpression);
        return parsedExpression;
    }
}
