package org.influence.analytics.query.catalog;

import org.influence.analytics.filter.model.FilterParameter;
import org.influence.analytics.query.model.AggregationKind;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.WarehouseTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static metadata for one analytic operation: which tables it touches, what it accepts,
 * and the bounds applied to its window and row limit.
 */
public final class OperationDescriptor {

    private final OperationId id;
    private final String description;
    private final AggregationKind kind;
    private final WarehouseTable baseTable;
    private final Map<WarehouseTable, JoinRequirement> joinable;
    private final boolean unionsContent;
    private final int windowDefault;
    private final int windowMin;
    private final int windowMax;
    private final int limitDefault;
    private final int limitMax;
    private final int previewSize;
    private final Set<FilterParameter> accepted;
    private final Set<FilterParameter> required;
    private final FilterParameter comparisonParameter;
    private final int minComparisonCardinality;
    private final Map<FilterParameter, Object> parameterDefaults;
    private final boolean enrichImages;

    private OperationDescriptor(Builder b) {
        this.id = b.id;
        this.description = b.description;
        this.kind = b.kind;
        this.baseTable = b.baseTable;
        this.joinable = Collections.unmodifiableMap(new EnumMap<>(b.joinable));
        this.unionsContent = b.unionsContent;
        this.windowDefault = b.windowDefault;
        this.windowMin = b.windowMin;
        this.windowMax = b.windowMax;
        this.limitDefault = b.limitDefault;
        this.limitMax = b.limitMax;
        this.previewSize = b.previewSize;
        this.accepted = Collections.unmodifiableSet(b.accepted);
        this.required = Collections.unmodifiableSet(b.required);
        this.comparisonParameter = b.comparisonParameter;
        this.minComparisonCardinality = b.minComparisonCardinality;
        this.parameterDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameterDefaults));
        this.enrichImages = b.enrichImages;
    }

    public static Builder builder(OperationId id, AggregationKind kind) {
        return new Builder(id, kind);
    }

    public OperationId getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public AggregationKind getKind() {
        return kind;
    }

    public WarehouseTable getBaseTable() {
        return baseTable;
    }

    public Map<WarehouseTable, JoinRequirement> getJoinable() {
        return joinable;
    }

    public boolean isUnionsContent() {
        return unionsContent;
    }

    public boolean isWindowed() {
        return windowMax > 0;
    }

    public int getWindowDefault() {
        return windowDefault;
    }

    public int getWindowMin() {
        return windowMin;
    }

    public int getWindowMax() {
        return windowMax;
    }

    public int getLimitDefault() {
        return limitDefault;
    }

    public int getLimitMax() {
        return limitMax;
    }

    public int getPreviewSize() {
        return previewSize;
    }

    public Set<FilterParameter> getAccepted() {
        return accepted;
    }

    public Set<FilterParameter> getRequired() {
        return required;
    }

    public FilterParameter getComparisonParameter() {
        return comparisonParameter;
    }

    public int getMinComparisonCardinality() {
        return minComparisonCardinality;
    }

    public Map<FilterParameter, Object> getParameterDefaults() {
        return parameterDefaults;
    }

    public boolean isEnrichImages() {
        return enrichImages;
    }

    public static final class Builder {
        private final OperationId id;
        private final AggregationKind kind;
        private String description = "";
        private WarehouseTable baseTable = WarehouseTable.GENERAL_PROFILES;
        private final Map<WarehouseTable, JoinRequirement> joinable = new EnumMap<>(WarehouseTable.class);
        private boolean unionsContent;
        private int windowDefault;
        private int windowMin;
        private int windowMax;
        private int limitDefault = 50;
        private int limitMax = 500;
        private int previewSize = 20;
        private final Set<FilterParameter> accepted = EnumSet.of(FilterParameter.LIMIT);
        private final Set<FilterParameter> required = EnumSet.noneOf(FilterParameter.class);
        private FilterParameter comparisonParameter;
        private int minComparisonCardinality;
        private final Map<FilterParameter, Object> parameterDefaults = new LinkedHashMap<>();
        private boolean enrichImages;

        private Builder(OperationId id, AggregationKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder join(WarehouseTable table, JoinRequirement requirement) {
            joinable.put(table, requirement);
            return this;
        }

        public Builder unionsContent() {
            this.unionsContent = true;
            return this;
        }

        public Builder window(int defaultDays, int minDays, int maxDays) {
            this.windowDefault = defaultDays;
            this.windowMin = minDays;
            this.windowMax = maxDays;
            accepted.add(FilterParameter.PERIOD_DAYS);
            return this;
        }

        public Builder limit(int defaultLimit, int maxLimit) {
            this.limitDefault = defaultLimit;
            this.limitMax = maxLimit;
            return this;
        }

        public Builder preview(int size) {
            this.previewSize = size;
            return this;
        }

        public Builder accepts(Set<FilterParameter> parameters) {
            accepted.addAll(parameters);
            return this;
        }

        public Builder accepts(FilterParameter... parameters) {
            Collections.addAll(accepted, parameters);
            return this;
        }

        public Builder requires(FilterParameter... parameters) {
            Collections.addAll(required, parameters);
            Collections.addAll(accepted, parameters);
            return this;
        }

        public Builder compares(FilterParameter parameter, int minCardinality) {
            this.comparisonParameter = parameter;
            this.minComparisonCardinality = minCardinality;
            return requires(parameter);
        }

        public Builder defaultValue(FilterParameter parameter, Object value) {
            parameterDefaults.put(parameter, value);
            return this;
        }

        public Builder enrichImages() {
            this.enrichImages = true;
            return this;
        }

        public OperationDescriptor build() {
            if (windowMax > OperationCatalog.MAX_WINDOW_DAYS) {
                throw new IllegalStateException(id + " window ceiling exceeds " + OperationCatalog.MAX_WINDOW_DAYS);
            }
            if (limitDefault < 1 || limitDefault > limitMax) {
                throw new IllegalStateException(id + " default limit outside [1, " + limitMax + "]");
            }
            if (previewSize < 1 || previewSize > 100) {
                throw new IllegalStateException(id + " preview size outside [1, 100]");
            }
            return new OperationDescriptor(this);
        }
    }
}
