package org.influence.analytics.aggregation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Post-processing an operation applies to the rows the warehouse returned.
 */
public final class AnalysisSpec {

    private final List<MetricDerivation> derivations;
    private final List<String> hiddenColumns;
    private final WindowComparison windowComparison;
    private final EntityCompletion entityCompletion;
    private final Distribution distribution;
    private final Ranking ranking;

    private AnalysisSpec(Builder b) {
        this.derivations = List.copyOf(b.derivations);
        this.hiddenColumns = List.copyOf(b.hiddenColumns);
        this.windowComparison = b.windowComparison;
        this.entityCompletion = b.entityCompletion;
        this.distribution = b.distribution;
        this.ranking = b.ranking;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalysisSpec none() {
        return builder().build();
    }

    public List<MetricDerivation> getDerivations() {
        return derivations;
    }

    public List<String> getHiddenColumns() {
        return hiddenColumns;
    }

    public WindowComparison getWindowComparison() {
        return windowComparison;
    }

    public EntityCompletion getEntityCompletion() {
        return entityCompletion;
    }

    public Distribution getDistribution() {
        return distribution;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public static final class Builder {
        private final List<MetricDerivation> derivations = new ArrayList<>();
        private final List<String> hiddenColumns = new ArrayList<>();
        private WindowComparison windowComparison;
        private EntityCompletion entityCompletion;
        private Distribution distribution;
        private Ranking ranking;

        private Builder() {
        }

        public Builder derive(MetricDerivation derivation) {
            derivations.add(derivation);
            return this;
        }

        public Builder hide(String... columns) {
            Collections.addAll(hiddenColumns, columns);
            return this;
        }

        public Builder compareWindows(WindowComparison comparison) {
            this.windowComparison = comparison;
            return this;
        }

        public Builder complete(EntityCompletion completion) {
            this.entityCompletion = completion;
            return this;
        }

        public Builder distribution(Distribution value) {
            this.distribution = value;
            return this;
        }

        public Builder rank(Ranking value) {
            this.ranking = value;
            return this;
        }

        public AnalysisSpec build() {
            return new AnalysisSpec(this);
        }
    }
}
