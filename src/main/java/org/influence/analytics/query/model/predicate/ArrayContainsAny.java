package org.influence.analytics.query.model.predicate;

import java.util.List;

/**
 * Membership of any value in an array column: {@code (has(col, ?) OR has(col, ?))}.
 */
public final class ArrayContainsAny implements Predicate {

    private final String column;
    private final List<Object> values;

    public ArrayContainsAny(String column, List<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values for array membership on " + column);
        }
        this.column = column;
        this.values = List.copyOf(values);
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        if (values.size() > 1) {
            sql.append('(');
        }
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append("has(").append(column).append(", ?)");
            params.add(values.get(i));
        }
        if (values.size() > 1) {
            sql.append(')');
        }
    }
}
