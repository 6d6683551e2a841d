package org.influence.analytics.query.model;

import java.util.List;
import java.util.Objects;

/**
 * Warehouse-ready SQL text plus its positional parameters.
 */
public final class RenderedQuery {

    private final String label;
    private final String sql;
    private final List<Object> params;

    public RenderedQuery(String label, String sql, List<Object> params) {
        this.label = label;
        this.sql = sql;
        this.params = List.copyOf(params);
    }

    public String getLabel() {
        return label;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RenderedQuery)) {
            return false;
        }
        RenderedQuery that = (RenderedQuery) o;
        return label.equals(that.label) && sql.equals(that.sql) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, sql, params);
    }
}
