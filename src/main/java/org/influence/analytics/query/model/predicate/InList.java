package org.influence.analytics.query.model.predicate;

import java.util.Collections;
import java.util.List;

/**
 * Scalar column restricted to a set of values.
 */
public final class InList implements Predicate {

    private final String column;
    private final List<Object> values;

    public InList(String column, List<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Empty IN list for " + column);
        }
        this.column = column;
        this.values = List.copyOf(values);
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append(column).append(" IN (")
                .append(String.join(", ", Collections.nCopies(values.size(), "?")))
                .append(')');
        params.addAll(values);
    }
}
