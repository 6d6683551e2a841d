package org.influence.analytics.filter.service;

import org.influence.analytics.engine.exception.ValidationException;
import org.influence.analytics.filter.model.FilterParameter;
import org.influence.analytics.filter.model.WireValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Type coercion for raw JSON-decoded parameter values. Every failure names the parameter.
 */
final class ParameterReader {

    private static final int MAX_TEXT_LENGTH = 200;

    private ParameterReader() {
    }

    /**
     * Reads a string or a collection of strings. Blank entries are rejected; an empty collection yields an empty list.
     */
    static List<String> strings(FilterParameter parameter, Object raw) {
        List<String> values = new ArrayList<>();
        for (Object element : elements(parameter, raw)) {
            values.add(text(parameter, element));
        }
        return values;
    }

    static String text(FilterParameter parameter, Object raw) {
        if (!(raw instanceof String)) {
            throw new ValidationException(parameter.getWireName(), "expected text but got " + describe(raw));
        }
        String value = ((String) raw).trim();
        if (value.isEmpty()) {
            throw new ValidationException(parameter.getWireName(), "must not be blank");
        }
        if (value.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException(parameter.getWireName(),
                    "must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        return value;
    }

    static <E extends Enum<E> & WireValue> E enumValue(FilterParameter parameter, Class<E> type, Object raw) {
        String value = text(parameter, raw);
        for (E candidate : type.getEnumConstants()) {
            if (candidate.getWireValue().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new ValidationException(parameter.getWireName(),
                String.format("'%s' is not one of %s", value, allowed(type)));
    }

    static <E extends Enum<E> & WireValue> Set<E> enumSet(FilterParameter parameter, Class<E> type, Object raw) {
        Set<E> values = EnumSet.noneOf(type);
        for (Object element : elements(parameter, raw)) {
            values.add(enumValue(parameter, type, element));
        }
        return values;
    }

    /**
     * Like {@link #enumSet} but keeps the caller's order, dropping repeats.
     */
    static <E extends Enum<E> & WireValue> List<E> enumList(FilterParameter parameter, Class<E> type, Object raw) {
        List<E> values = new ArrayList<>();
        for (Object element : elements(parameter, raw)) {
            E value = enumValue(parameter, type, element);
            if (!values.contains(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * A single value reads as a one-element list. Null entries are rejected.
     */
    private static List<Object> elements(FilterParameter parameter, Object raw) {
        List<Object> elements = new ArrayList<>();
        if (raw instanceof Collection) {
            elements.addAll((Collection<?>) raw);
        } else {
            elements.add(raw);
        }
        for (Object element : elements) {
            if (element == null) {
                throw new ValidationException(parameter.getWireName(), "must not contain null");
            }
        }
        return elements;
    }

    static long wholeNumber(FilterParameter parameter, Object raw) {
        BigDecimal value = decimal(parameter, raw);
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException(parameter.getWireName(), "must be a whole number but was " + value);
        }
    }

    static double number(FilterParameter parameter, Object raw) {
        return decimal(parameter, raw).doubleValue();
    }

    static boolean bool(FilterParameter parameter, Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof String) {
            String value = ((String) raw).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(value)) {
                return true;
            }
            if ("false".equals(value)) {
                return false;
            }
        }
        throw new ValidationException(parameter.getWireName(), "expected true or false but got " + describe(raw));
    }

    private static BigDecimal decimal(FilterParameter parameter, Object raw) {
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ValidationException(parameter.getWireName(), "must be a finite number");
            }
            return BigDecimal.valueOf(value);
        }
        if (raw instanceof Number) {
            return new BigDecimal(raw.toString());
        }
        if (raw instanceof String) {
            try {
                return new BigDecimal(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(parameter.getWireName(), "'" + raw + "' is not a number");
            }
        }
        throw new ValidationException(parameter.getWireName(), "expected a number but got " + describe(raw));
    }

    private static <E extends Enum<E> & WireValue> String allowed(Class<E> type) {
        List<String> names = new ArrayList<>();
        for (E candidate : type.getEnumConstants()) {
            names.add(candidate.getWireValue());
        }
        return names.toString();
    }

    private static String describe(Object raw) {
        if (raw == null) {
            return "null";
        }
        if (raw instanceof Collection) {
            return "a list";
        }
        if (raw instanceof java.util.Map) {
            return "an object";
        }
        return raw.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}
