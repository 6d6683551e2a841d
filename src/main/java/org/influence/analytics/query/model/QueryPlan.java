package org.influence.analytics.query.model;

import org.influence.analytics.query.model.predicate.Predicate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled, warehouse-executable description of one query.
 * <p>
 * Optional-filter predicates derived from the caller's filters are kept apart from the
 * operation's own shape predicates, so it is always visible which restrictions the caller
 * asked for. Profile predicates apply to the profile side ({@code g}, {@code b}, {@code p},
 * {@code l}); content predicates apply to unioned content rows ({@code c}).
 */
public final class QueryPlan {

    private final OperationId operation;
    private final PlanRole role;
    private final boolean required;
    private final WarehouseTable baseTable;
    private final List<Join> joins;
    private final List<SqlFragment> profileProjections;
    private final ContentSource content;
    private final List<Predicate> filterPredicates;
    private final List<Predicate> shapePredicates;
    private final List<Predicate> contentPredicates;
    private final List<SqlFragment> select;
    private final List<String> groupBy;
    private final Predicate having;
    private final List<String> orderBy;
    private final Integer limitPerGroup;
    private final String limitPerGroupColumn;
    private final int limit;
    private final LocalDate partitionLowerBound;
    private final String keyColumn;
    private final QueryPlan keySource;

    private QueryPlan(Builder b) {
        this.operation = b.operation;
        this.role = b.role;
        this.required = b.required;
        this.baseTable = b.baseTable;
        this.joins = List.copyOf(b.joins);
        this.profileProjections = List.copyOf(b.profileProjections);
        this.content = b.content;
        this.filterPredicates = List.copyOf(b.filterPredicates);
        this.shapePredicates = List.copyOf(b.shapePredicates);
        this.contentPredicates = List.copyOf(b.contentPredicates);
        this.select = List.copyOf(b.select);
        this.groupBy = List.copyOf(b.groupBy);
        this.having = b.having;
        this.orderBy = List.copyOf(b.orderBy);
        this.limitPerGroup = b.limitPerGroup;
        this.limitPerGroupColumn = b.limitPerGroupColumn;
        this.limit = b.limit;
        this.partitionLowerBound = b.partitionLowerBound;
        this.keyColumn = b.keyColumn;
        this.keySource = b.keySource;
    }

    public static Builder builder(OperationId operation, PlanRole role) {
        return new Builder(operation, role);
    }

    public OperationId getOperation() {
        return operation;
    }

    public PlanRole getRole() {
        return role;
    }

    /**
     * Whether the operation fails when this plan fails. Optional plans only enrich the result.
     */
    public boolean isRequired() {
        return required;
    }

    public WarehouseTable getBaseTable() {
        return baseTable;
    }

    public List<Join> getJoins() {
        return joins;
    }

    public List<SqlFragment> getProfileProjections() {
        return profileProjections;
    }

    public ContentSource getContent() {
        return content;
    }

    public boolean hasContent() {
        return content != null;
    }

    public List<Predicate> getFilterPredicates() {
        return filterPredicates;
    }

    public List<Predicate> getShapePredicates() {
        return shapePredicates;
    }

    public List<Predicate> getContentPredicates() {
        return contentPredicates;
    }

    public List<SqlFragment> getSelect() {
        return select;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public Predicate getHaving() {
        return having;
    }

    public List<String> getOrderBy() {
        return orderBy;
    }

    public Integer getLimitPerGroup() {
        return limitPerGroup;
    }

    public String getLimitPerGroupColumn() {
        return limitPerGroupColumn;
    }

    public int getLimit() {
        return limit;
    }

    public LocalDate getPartitionLowerBound() {
        return partitionLowerBound;
    }

    /**
     * Output column whose values must also appear in {@link #getKeySource()}, or null.
     */
    public String getKeyColumn() {
        return keyColumn;
    }

    /**
     * Plan whose key column bounds the keys this plan may return, or null when unrestricted.
     */
    public QueryPlan getKeySource() {
        return keySource;
    }

    public boolean joins(WarehouseTable table) {
        return joins.stream().anyMatch(join -> join.getTable() == table);
    }

    public static final class Builder {
        private final OperationId operation;
        private final PlanRole role;
        private boolean required = true;
        private WarehouseTable baseTable = WarehouseTable.GENERAL_PROFILES;
        private final List<Join> joins = new ArrayList<>();
        private final List<SqlFragment> profileProjections = new ArrayList<>();
        private ContentSource content;
        private final List<Predicate> filterPredicates = new ArrayList<>();
        private final List<Predicate> shapePredicates = new ArrayList<>();
        private final List<Predicate> contentPredicates = new ArrayList<>();
        private final List<SqlFragment> select = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private Predicate having;
        private final List<String> orderBy = new ArrayList<>();
        private Integer limitPerGroup;
        private String limitPerGroupColumn;
        private int limit;
        private LocalDate partitionLowerBound;
        private String keyColumn;
        private QueryPlan keySource;

        private Builder(OperationId operation, PlanRole role) {
            this.operation = operation;
            this.role = role;
        }

        public Builder required(boolean value) {
            this.required = value;
            return this;
        }

        public Builder baseTable(WarehouseTable table) {
            this.baseTable = table;
            return this;
        }

        public Builder join(Join join) {
            if (!joins.contains(join)) {
                joins.add(join);
            }
            return this;
        }

        public Builder profileProjection(SqlFragment projection) {
            profileProjections.add(projection);
            return this;
        }

        public Builder content(ContentSource source) {
            this.content = source;
            return this;
        }

        public Builder filterPredicate(Predicate predicate) {
            filterPredicates.add(predicate);
            return this;
        }

        public Builder shapePredicate(Predicate predicate) {
            shapePredicates.add(predicate);
            return this;
        }

        public Builder contentPredicate(Predicate predicate) {
            contentPredicates.add(predicate);
            return this;
        }

        public Builder select(SqlFragment item) {
            select.add(item);
            return this;
        }

        public Builder select(String item) {
            select.add(SqlFragment.of(item));
            return this;
        }

        public Builder groupBy(String... columns) {
            Collections.addAll(groupBy, columns);
            return this;
        }

        public Builder having(Predicate predicate) {
            this.having = predicate;
            return this;
        }

        public Builder orderBy(String... terms) {
            Collections.addAll(orderBy, terms);
            return this;
        }

        public Builder limitPerGroup(int perGroup, String column) {
            this.limitPerGroup = perGroup;
            this.limitPerGroupColumn = column;
            return this;
        }

        public Builder limit(int value) {
            this.limit = value;
            return this;
        }

        public Builder partitionLowerBound(LocalDate value) {
            this.partitionLowerBound = value;
            return this;
        }

        /**
         * Only return keys that the source plan returns in the same column.
         */
        public Builder keysFrom(String column, QueryPlan source) {
            this.keyColumn = column;
            this.keySource = source;
            return this;
        }

        public QueryPlan build() {
            return new QueryPlan(this);
        }
    }
}
