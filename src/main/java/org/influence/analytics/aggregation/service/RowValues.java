package org.influence.analytics.aggregation.service;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * Lenient numeric reads from warehouse rows. Missing and non-finite values read as zero,
 * which is how ClickHouse reports aggregates over empty groups.
 */
final class RowValues {

    private RowValues() {
    }

    static long longValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number) {
            double asDouble = ((Number) value).doubleValue();
            if (Double.isNaN(asDouble)) {
                return 0;
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValue();
            }
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Column " + column + " is not numeric: " + value, e);
            }
        }
        return 0;
    }

    static double doubleValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number) {
            double asDouble = ((Number) value).doubleValue();
            return Double.isNaN(asDouble) || Double.isInfinite(asDouble) ? 0 : asDouble;
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Column " + column + " is not numeric: " + value, e);
            }
        }
        return 0;
    }

    static double[] sample(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .filter(Number.class::isInstance)
                    .mapToDouble(v -> ((Number) v).doubleValue())
                    .toArray();
        }
        if (value instanceof Object[]) {
            Object[] elements = (Object[]) value;
            double[] sample = new double[elements.length];
            for (int i = 0; i < elements.length; i++) {
                sample[i] = elements[i] instanceof Number ? ((Number) elements[i]).doubleValue() : 0;
            }
            return sample;
        }
        if (value instanceof long[]) {
            return Arrays.stream((long[]) value).asDoubleStream().toArray();
        }
        if (value instanceof int[]) {
            return Arrays.stream((int[]) value).asDoubleStream().toArray();
        }
        if (value instanceof double[]) {
            return (double[]) value;
        }
        return new double[0];
    }
}
