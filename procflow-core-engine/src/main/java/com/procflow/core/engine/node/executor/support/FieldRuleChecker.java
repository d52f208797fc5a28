package com.procflow.core.engine.node.executor.support;

import com.procflow.core.util.CastUtil;
import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.models.commons.FileReference;
import com.procflow.integration.models.workflow.FieldDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks values against {@link FieldDefinition} rules. Used twice: on trigger input, where
 * every finding is a validation error, and on extraction output, where findings become
 * anomaly flags for the reviewer.
 */
public final class FieldRuleChecker {

    public static final String REQUIRED_MISSING = "REQUIRED_MISSING";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String BELOW_MIN = "BELOW_MIN";
    public static final String ABOVE_MAX = "ABOVE_MAX";
    public static final String PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String NOT_ALLOWED = "NOT_ALLOWED";

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private FieldRuleChecker() {}

    /**
     * One finding per violated rule, in field declaration order.
     */
    public static List<Map<String, Object>> check(List<FieldDefinition> fields, Map<String, Object> values) {
        List<Map<String, Object>> findings = new ArrayList<>();
        if (fields == null) {
            return findings;
        }
        for (FieldDefinition field : fields) {
            Object value = values == null ? null : values.get(field.getName());
            if (isMissing(value)) {
                if (field.isRequired()) {
                    findings.add(finding(field, REQUIRED_MISSING, "Required field '" + field.getName() + "' is missing"));
                }
                continue;
            }
            if (!hasDeclaredType(value, field.getType())) {
                findings.add(finding(field, TYPE_MISMATCH,
                        "Field '" + field.getName() + "' is not a valid " + field.getType()));
                continue;
            }
            checkRange(field, value, findings);
            checkPattern(field, value, findings);
            checkAllowed(field, value, findings);
        }
        return findings;
    }

    /**
     * Findings rendered as plain messages.
     */
    public static List<String> messages(List<Map<String, Object>> findings) {
        return findings.stream().map(finding -> String.valueOf(finding.get("message"))).toList();
    }

    static boolean isMissing(Object value) {
        return value == null
                || (value instanceof CharSequence text && text.toString().isBlank())
                || (value instanceof Collection<?> collection && collection.isEmpty());
    }

    static boolean hasDeclaredType(Object value, ProcFlowFieldType type) {
        if (type == null) {
            return true;
        }
        switch (type) {
            case NUMBER:
            case CURRENCY:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case DATE:
                return CastUtil.castAsLocalDate(value) != null;
            case LIST:
                return value instanceof Collection<?>;
            case EMAIL:
                return value instanceof CharSequence && EMAIL.matcher(value.toString()).matches();
            case FILE:
                return FileReference.from(value).isPresent();
            case TEXT:
            default:
                return true;
        }
    }

    private static void checkRange(FieldDefinition field, Object value, List<Map<String, Object>> findings) {
        Double measured = measure(value, field.getType());
        if (measured == null) {
            return;
        }
        if (field.getMin() != null && measured < field.getMin()) {
            findings.add(finding(field, BELOW_MIN,
                    "Field '" + field.getName() + "' is below the minimum of " + CastUtil.castAsString(field.getMin())));
        }
        if (field.getMax() != null && measured > field.getMax()) {
            findings.add(finding(field, ABOVE_MAX,
                    "Field '" + field.getName() + "' is above the maximum of " + CastUtil.castAsString(field.getMax())));
        }
    }

    /**
     * Numbers are compared by value, text by length and lists by size.
     */
    private static Double measure(Object value, ProcFlowFieldType type) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (type == ProcFlowFieldType.TEXT && value instanceof CharSequence text) {
            return (double) text.length();
        }
        if (value instanceof Collection<?> collection) {
            return (double) collection.size();
        }
        return null;
    }

    private static void checkPattern(FieldDefinition field, Object value, List<Map<String, Object>> findings) {
        if (field.getPattern() == null || field.getPattern().isBlank()) {
            return;
        }
        boolean matches;
        try {
            matches = Pattern.compile(field.getPattern()).matcher(CastUtil.castAsString(value)).matches();
        } catch (PatternSyntaxException e) {
            findings.add(finding(field, PATTERN_MISMATCH,
                    "Field '" + field.getName() + "' declares an invalid pattern: " + e.getDescription()));
            return;
        }
        if (!matches) {
            findings.add(finding(field, PATTERN_MISMATCH,
                    "Field '" + field.getName() + "' does not match pattern " + field.getPattern()));
        }
    }

    private static void checkAllowed(FieldDefinition field, Object value, List<Map<String, Object>> findings) {
        List<String> allowed = field.getAllowedValues();
        if (allowed == null || allowed.isEmpty()) {
            return;
        }
        if (!allowed.contains(CastUtil.castAsString(value))) {
            findings.add(finding(field, NOT_ALLOWED,
                    "Field '" + field.getName() + "' must be one of " + allowed));
        }
    }

    private static Map<String, Object> finding(FieldDefinition field, String rule, String message) {
        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("field", field.getName());
        finding.put("rule", rule);
        finding.put("message", message);
        return finding;
    }
}
