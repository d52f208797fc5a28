package com.procflow.integration.contract.expression;

import com.procflow.integration.exception.ProcFlowExpressionException;

import java.util.Map;

/**
 * Evaluates small derived-value expressions against a flat variable scope.
 *
 * <p>Implementations must be pure: no I/O, no side effects, no access to anything outside
 * the supplied scope, and bounded nesting depth. All failures surface as
 * {@link ProcFlowExpressionException}.</p>
 */
public interface IProcFlowExpressionEvaluator {

    Object evaluate(String expression, Map<String, Object> scope);

    /**
     * Evaluates and applies truthiness rules: null is false, numbers are true when non-zero,
     * strings and collections when non-empty.
     */
    boolean evaluateCondition(String expression, Map<String, Object> scope);

    /**
     * Replaces every {@code {{ expression }}} in the template with its string value.
     */
    String interpolate(String template, Map<String, Object> scope);

    /**
     * Interpolates strings inside maps and lists recursively. A string consisting of exactly one
     * placeholder yields the raw evaluated value instead of its string form.
     */
    Object interpolateValue(Object value, Map<String, Object> scope);

    /**
     * Parses without evaluating.
     *
     * @throws ProcFlowExpressionException with reason {@code SYNTAX} or {@code LIMIT_EXCEEDED}
     */
    void validateSyntax(String expression);
}
