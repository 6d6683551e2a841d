package org.influence.analytics.query.model.predicate;

import java.util.Collections;
import java.util.List;

/**
 * Every value is present in an array expression: {@code hasAll(expr, [?, ?])}.
 */
public final class ArrayContainsAll implements Predicate {

    private final String expression;
    private final List<Object> values;

    public ArrayContainsAll(String expression, List<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values for hasAll on " + expression);
        }
        this.expression = expression;
        this.values = List.copyOf(values);
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append("hasAll(").append(expression).append(", [")
                .append(String.join(", ", Collections.nCopies(values.size(), "?")))
                .append("])");
        params.addAll(values);
    }
}
