package com.procflow.core.engine.expression.spel;

import com.procflow.core.engine.expression.functions.ExpressionFunctionRegistry;
import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.exception.ProcFlowExpressionException.Reason;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.Assign;
import org.springframework.expression.spel.ast.BeanReference;
import org.springframework.expression.spel.ast.ConstructorReference;
import org.springframework.expression.spel.ast.FunctionReference;
import org.springframework.expression.spel.ast.MethodReference;
import org.springframework.expression.spel.ast.OpDec;
import org.springframework.expression.spel.ast.OpInc;
import org.springframework.expression.spel.ast.TypeReference;
import org.springframework.expression.spel.ast.VariableReference;

/**
 * Restricts SpEL to the engine's expression language. Nesting is checked on the raw text before
 * parsing and again on the parsed tree; type references, constructors, bean references,
 * assignments, variables other than {@code #this} and {@code #root}, and calls to anything but a
 * registered function are rejected.
 */
public class ExpressionGuard {

    private final ExpressionFunctionRegistry functions;
    private final int maxDepth;

    public ExpressionGuard(ExpressionFunctionRegistry functions, int maxDepth) {
        this.functions = functions;
        this.maxDepth = maxDepth;
    }

    public void checkText(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ProcFlowExpressionException(Reason.SYNTAX, "expression is empty", expression);
        }
        int depth = 0;
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(expression, i, c);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                if (depth > maxDepth) {
                    throw limitExceeded(expression);
                }
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            i++;
        }
    }

    public void checkTree(SpelNode root, String expression) {
        check(root, 1, expression);
    }

    private void check(SpelNode node, int depth, String expression) {
        if (depth > maxDepth) {
            throw limitExceeded(expression);
        }
        if (node instanceof Assign || node instanceof OpInc || node instanceof OpDec
                || node instanceof TypeReference || node instanceof ConstructorReference
                || node instanceof BeanReference) {
            throw new ProcFlowExpressionException(Reason.SYNTAX,
                    "'" + node.toStringAST() + "' is not supported", expression);
        }
        if (node instanceof FunctionReference) {
            throw new ProcFlowExpressionException(Reason.UNKNOWN_FUNCTION,
                    "unknown function '" + node.toStringAST() + "'", expression);
        }
        if (node instanceof VariableReference) {
            String variable = node.toStringAST();
            if (!"#this".equals(variable) && !"#root".equals(variable)) {
                throw new ProcFlowExpressionException(Reason.SYNTAX,
                        "variable '" + variable + "' is not supported", expression);
            }
        }
        if (node instanceof MethodReference method && functions.getFunction(method.getName()) == null) {
            throw new ProcFlowExpressionException(Reason.UNKNOWN_FUNCTION,
                    "unknown function '" + method.getName() + "'", expression);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            check(node.getChild(i), depth + 1, expression);
        }
    }

    /**
     * Index just past the closing quote; a doubled quote inside the literal is an escaped quote.
     */
    private static int skipQuoted(String expression, int start, char quote) {
        int i = start + 1;
        while (i < expression.length()) {
            if (expression.charAt(i) == quote) {
                if (i + 1 < expression.length() && expression.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private ProcFlowExpressionException limitExceeded(String expression) {
        return new ProcFlowExpressionException(Reason.LIMIT_EXCEEDED,
                "expression nesting exceeds " + maxDepth, expression);
    }
}
