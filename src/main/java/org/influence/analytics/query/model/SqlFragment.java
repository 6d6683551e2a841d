package org.influence.analytics.query.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL text together with the values bound to its {@code ?} placeholders, in order.
 */
public final class SqlFragment {

    private final String text;
    private final List<Object> params;

    private SqlFragment(String text, List<Object> params) {
        this.text = text;
        this.params = params;
    }

    public static SqlFragment of(String text, Object... params) {
        return new SqlFragment(text, List.copyOf(Arrays.asList(params)));
    }

    public static SqlFragment of(String text, List<?> params) {
        return new SqlFragment(text, List.copyOf(params));
    }

    public String getText() {
        return text;
    }

    public List<Object> getParams() {
        return params;
    }

    public void appendTo(StringBuilder sql, List<Object> boundParams) {
        sql.append(text);
        boundParams.addAll(params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SqlFragment)) {
            return false;
        }
        SqlFragment that = (SqlFragment) o;
        return text.equals(that.text) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, params);
    }

    @Override
    public String toString() {
        return text;
    }
}
