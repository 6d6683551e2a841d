package org.influence.analytics.query.model.predicate;

import java.util.List;

/**
 * Constant condition that is part of an operation's shape, such as a non-empty column check.
 * Never built from caller input.
 */
public final class FixedCondition implements Predicate {

    private final String text;

    public FixedCondition(String text) {
        this.text = text;
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append(text);
    }
}
