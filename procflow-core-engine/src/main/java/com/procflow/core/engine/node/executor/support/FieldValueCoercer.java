package com.procflow.core.engine.node.executor.support;

import com.procflow.core.engine.misc.ProcFlowObjectMapper;
import com.procflow.core.util.CastUtil;
import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.models.commons.FileReference;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalises loosely typed extraction results to the declared field types.
 * Values that cannot be coerced are returned unchanged so that rule checks can flag them.
 */
@Slf4j
public final class FieldValueCoercer {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("MM/dd/uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("dd.MM.uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("uuuu/MM/dd", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, uuuu", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH)
    );

    private FieldValueCoercer() {}

    public static Object coerce(Object value, ProcFlowFieldType type) {
        if (value == null || type == null) {
            return value;
        }
        switch (type) {
            case NUMBER:
            case CURRENCY:
                return toNumber(value);
            case BOOLEAN:
                return toBoolean(value);
            case DATE:
                return toIsoDate(value);
            case LIST:
                return toList(value);
            case FILE:
                return FileReference.from(value).<Object>map(reference -> reference).orElse(value);
            case TEXT:
            case EMAIL:
                return value instanceof String text ? text.trim() : value;
            default:
                return value;
        }
    }

    static Object toNumber(Object value) {
        if (value instanceof Number number) {
            return CastUtil.isIntegral(number) ? (Object) number.longValue() : (Object) number.doubleValue();
        }
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        boolean negative = trimmed.startsWith("(") && trimmed.endsWith(")");
        String digits = NON_NUMERIC.matcher(trimmed).replaceAll("");
        if (!NUMERIC.matcher(digits).matches()) {
            return value;
        }
        if (negative && !digits.startsWith("-")) {
            digits = "-" + digits;
        }
        return digits.contains(".") ? (Object) Double.parseDouble(digits) : (Object) Long.parseLong(digits);
    }

    static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        String word = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return true;
        }
        if (FALSE_WORDS.contains(word)) {
            return false;
        }
        return value;
    }

    static Object toIsoDate(Object value) {
        LocalDate date = CastUtil.castAsLocalDate(value);
        if (date != null) {
            return date.toString();
        }
        if (value instanceof String text) {
            for (DateTimeFormatter format : DATE_FORMATS) {
                LocalDate parsed = parse(text.trim(), format);
                if (parsed != null) {
                    return parsed.toString();
                }
            }
        }
        return value;
    }

    private static LocalDate parse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Object toList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        if (!(value instanceof String text)) {
            return value instanceof Map<?, ?> ? value : new ArrayList<>(List.of(value));
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        if (trimmed.startsWith("[")) {
            try {
                return ProcFlowObjectMapper.getInstance().getObjectMapper().readValue(trimmed, List.class);
            } catch (JacksonException e) {
                log.debug("Value is not a JSON list, splitting on commas instead: {}", e.getOriginalMessage());
                trimmed = trimmed.substring(1, trimmed.endsWith("]") ? trimmed.length() - 1 : trimmed.length());
            }
        }
        List<Object> items = new ArrayList<>();
        for (String item : trimmed.split("[,;\\n]")) {
            String cleaned = item.trim();
            if (!cleaned.isEmpty()) {
                items.add(cleaned);
            }
        }
        return items;
    }
}
