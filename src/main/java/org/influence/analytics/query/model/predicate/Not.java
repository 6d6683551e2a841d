package org.influence.analytics.query.model.predicate;

import java.util.List;

public final class Not implements Predicate {

    private final Predicate inner;

    public Not(Predicate inner) {
        this.inner = inner;
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append("NOT (");
        inner.render(sql, params);
        sql.append(')');
    }
}
