package org.influence.analytics.query.model.predicate;

import java.time.LocalDate;
import java.util.List;

/**
 * Half-open date range on a column that the warehouse can prune on. The upper bound is optional.
 */
public final class DateRange implements Predicate {

    private final String column;
    private final LocalDate from;
    private final LocalDate toExclusive;

    public DateRange(String column, LocalDate from, LocalDate toExclusive) {
        this.column = column;
        this.from = from;
        this.toExclusive = toExclusive;
    }

    public LocalDate getFrom() {
        return from;
    }

    public LocalDate getToExclusive() {
        return toExclusive;
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append(column).append(" >= ?");
        params.add(from);
        if (toExclusive != null) {
            sql.append(" AND ").append(column).append(" < ?");
            params.add(toExclusive);
        }
    }
}
