package org.influence.analytics.query.model.predicate;

import org.influence.analytics.query.model.SqlFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * A boolean condition in a compiled plan. Rendering appends SQL text and the values for
 * its placeholders; user values never appear in the text itself.
 */
public interface Predicate {

    void render(StringBuilder sql, List<Object> params);

    default SqlFragment toFragment() {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        render(sql, params);
        return SqlFragment.of(sql.toString(), params);
    }
}
