package com.procflow.core.engine.expression;

import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.models.commons.FileReference;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only variable scope for one evaluation; the root object of every expression.
 *
 * <p>Variables are stored flat ({@code "extract.total"}), so a dotted path is resolved by the
 * longest leading run of names that matches a key. While a path is being walked, a prefix that
 * only exists as the head of longer keys ({@code extract}) resolves to a {@link Namespace}, and
 * the next name is looked up under it. The remaining names then navigate into maps, lists and
 * file references.</p>
 */
public class ExpressionScope {

    /**
     * A partially walked path such as {@code extract} when only {@code extract.total} is bound.
     */
    public record Namespace(String prefix, ExpressionScope scope) {

        /**
         * The value bound to the prefix itself or, failing that, a map of the keys below it.
         */
        public Object value() {
            return scope.unwrap(this);
        }
    }

    private final Map<String, Object> variables;
    private final String expression;
    private Set<String> prefixes;

    public ExpressionScope(Map<String, Object> variables, String expression) {
        this.variables = variables == null ? Collections.emptyMap() : variables;
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    // ========================================================================
    // PATH WALKING
    // ========================================================================

    /**
     * First name of a path, e.g. {@code extract} in {@code extract.total}.
     */
    public Object resolveRoot(String name) {
        if (isPrefix(name)) {
            return new Namespace(name, this);
        }
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        throw ProcFlowExpressionException.unknownIdentifier(name, expression);
    }

    /**
     * Next name of a path on an already resolved value.
     */
    public Object resolveMember(Object target, String name) {
        if (target instanceof Namespace namespace) {
            String key = namespace.prefix() + "." + name;
            if (isPrefix(key)) {
                return new Namespace(key, this);
            }
            if (variables.containsKey(key)) {
                return variables.get(key);
            }
            if (variables.containsKey(namespace.prefix())) {
                return member(variables.get(namespace.prefix()), name, key);
            }
            throw ProcFlowExpressionException.unknownIdentifier(key, expression);
        }
        return member(target, name, name);
    }

    /**
     * Replaces a namespace left over at the end of a path by the value bound to its own key or,
     * failing that, by a map of the keys below it. Other values are returned as they are.
     */
    public Object unwrap(Object value) {
        if (!(value instanceof Namespace namespace)) {
            return value;
        }
        if (variables.containsKey(namespace.prefix())) {
            return variables.get(namespace.prefix());
        }
        String head = namespace.prefix() + ".";
        Map<String, Object> view = new LinkedHashMap<>();
        variables.forEach((key, item) -> {
            if (key.startsWith(head)) {
                view.put(key.substring(head.length()), item);
            }
        });
        return view;
    }

    // ========================================================================
    // DOTTED LOOKUP
    // ========================================================================

    /**
     * Resolves a dotted path string such as {@code manager-approval.decision} or {@code items.0}.
     */
    public Object lookup(String dottedPath) {
        String[] segments = dottedPath.split("\\.", -1);
        for (int prefix = segments.length; prefix >= 1; prefix--) {
            String key = String.join(".", List.of(segments).subList(0, prefix));
            if (variables.containsKey(key)) {
                Object value = variables.get(key);
                for (int i = prefix; i < segments.length; i++) {
                    value = member(value, segments[i], dottedPath);
                }
                return value;
            }
        }
        throw ProcFlowExpressionException.unknownIdentifier(dottedPath, expression);
    }

    public boolean isDefined(String dottedPath) {
        try {
            lookup(dottedPath);
            return true;
        } catch (ProcFlowExpressionException e) {
            return false;
        }
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Object member(Object value, String name, String displayPath) {
        if (value instanceof Map<?, ?> map) {
            if (!map.containsKey(name)) {
                throw ProcFlowExpressionException.unknownIdentifier(displayPath, expression);
            }
            return map.get(name);
        } else if (value instanceof List<?> list && name.matches("\\d+")) {
            int index = Integer.parseInt(name);
            if (index >= list.size()) {
                throw ProcFlowExpressionException.unknownIdentifier(displayPath, expression);
            }
            return list.get(index);
        } else if (value instanceof FileReference reference) {
            return fileAttribute(reference, name, displayPath);
        }
        throw ProcFlowExpressionException.unknownIdentifier(displayPath, expression);
    }

    private Object fileAttribute(FileReference reference, String attribute, String displayPath) {
        switch (attribute) {
            case "id":
                return reference.getId();
            case "name":
                return reference.getName();
            case "size":
                return reference.getSize();
            case "contentType":
                return reference.getContentType();
            default:
                throw ProcFlowExpressionException.unknownIdentifier(displayPath, expression);
        }
    }

    /**
     * Whether some key continues {@code path} with a further dotted name.
     */
    private boolean isPrefix(String path) {
        if (prefixes == null) {
            Set<String> heads = new HashSet<>();
            for (String key : variables.keySet()) {
                int dot = key.indexOf('.');
                while (dot > 0) {
                    heads.add(key.substring(0, dot));
                    dot = key.indexOf('.', dot + 1);
                }
            }
            prefixes = heads;
        }
        return prefixes.contains(path);
    }
}
