package org.influence.analytics.query.model;

import org.influence.analytics.query.model.predicate.DateRange;

import java.time.LocalDate;

/**
 * One partitioned content table inside a union, bounded on its own partition column.
 */
public final class ContentBranch {

    private final WarehouseTable table;
    private final LocalDate lowerBound;
    private final LocalDate upperBoundExclusive;

    public ContentBranch(WarehouseTable table, LocalDate lowerBound, LocalDate upperBoundExclusive) {
        if (!table.isPartitioned()) {
            throw new IllegalArgumentException(table + " is not a partitioned content table");
        }
        this.table = table;
        this.lowerBound = lowerBound;
        this.upperBoundExclusive = upperBoundExclusive;
    }

    public WarehouseTable getTable() {
        return table;
    }

    public LocalDate getLowerBound() {
        return lowerBound;
    }

    public LocalDate getUpperBoundExclusive() {
        return upperBoundExclusive;
    }

    public DateRange partitionPredicate() {
        return new DateRange(table.column(table.getPartitionColumn()), lowerBound, upperBoundExclusive);
    }
}
