package org.influence.analytics.query.model;

import java.util.Objects;

/**
 * A profile-side join on equality of {@code user_id} with the base table.
 */
public final class Join {

    private final WarehouseTable table;
    private final JoinType type;

    public Join(WarehouseTable table, JoinType type) {
        this.table = table;
        this.type = type;
    }

    public WarehouseTable getTable() {
        return table;
    }

    public JoinType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Join)) {
            return false;
        }
        Join join = (Join) o;
        return table == join.table && type == join.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, type);
    }

    @Override
    public String toString() {
        return type + " " + table.getQualifiedName();
    }
}
