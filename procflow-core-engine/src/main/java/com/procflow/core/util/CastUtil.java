package com.procflow.core.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public class CastUtil {

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            LocalDate::parse,
            text -> LocalDateTime.parse(text).toLocalDate(),
            text -> OffsetDateTime.parse(text).toLocalDate()
    );

    private CastUtil() {}

    /**
     * Truthiness: null is false, numbers are true when non-zero, strings, collections and maps
     * when non-empty, anything else is true.
     */
    public static boolean isTruthy(Object e) {
        if (e == null) {
            return false;
        } else if (e instanceof Boolean bool) {
            return bool;
        } else if (e instanceof Number number) {
            return number.doubleValue() != 0.0;
        } else if (e instanceof CharSequence s) {
            return s.length() > 0;
        } else if (e instanceof Collection<?> collection) {
            return !collection.isEmpty();
        } else if (e instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    public static boolean isIntegral(Object e) {
        return e instanceof Integer || e instanceof Long || e instanceof Short
                || e instanceof Byte || e instanceof BigInteger;
    }

    public static double castAsDouble(Object e) {
        if (e instanceof Number number) {
            return number.doubleValue();
        } else if (e instanceof Boolean bool) {
            return bool ? 1.0 : 0.0;
        }
        return Double.parseDouble(e.toString());
    }

    public static long castAsLong(Object e) {
        if (e instanceof Number number) {
            return number.longValue();
        } else if (e instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        return Long.parseLong(e.toString());
    }

    public static String castAsString(Object e) {
        if (e == null) {
            return "";
        }
        if (e instanceof String string) {
            return string;
        }
        if (e instanceof Double || e instanceof Float || e instanceof BigDecimal) {
            return formatDecimal(((Number) e).doubleValue());
        }
        return e.toString();
    }

    /**
     * Converts ISO dates, ISO date-times and temporal objects to a {@link LocalDate}.
     *
     * @return the date, or null when the value is not a date
     */
    public static LocalDate castAsLocalDate(Object e) {
        if (e instanceof LocalDate date) {
            return date;
        } else if (e instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (e instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (e instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (e instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        } else if (e instanceof String s) {
            String text = s.trim();
            for (Function<String, LocalDate> parser : DATE_PARSERS) {
                LocalDate parsed = tryParse(parser, text);
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }

    /**
     * Numbers compare by value regardless of their boxed type; everything else by {@link Objects#equals}.
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return Objects.equals(left, right);
    }

    public static int compareNumbers(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isFinite(Number number) {
        return isIntegral(number) || number instanceof BigDecimal || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (isIntegral(number)) {
            return new BigDecimal(number.toString());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }

    private static LocalDate tryParse(Function<String, LocalDate> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Whole doubles print without a trailing {@code .0} so that interpolated amounts read naturally.
     */
    private static String formatDecimal(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
