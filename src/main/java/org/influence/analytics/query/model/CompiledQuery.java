package org.influence.analytics.query.model;

import org.influence.analytics.aggregation.model.AnalysisSpec;

import java.util.List;
import java.util.Optional;

/**
 * All plans one invocation needs, the post-processing their results go through, and a
 * one-line summary for the caller.
 */
public final class CompiledQuery {

    private final OperationId operation;
    private final List<QueryPlan> plans;
    private final AnalysisSpec analysis;
    private final String planSummary;

    public CompiledQuery(OperationId operation, List<QueryPlan> plans, AnalysisSpec analysis, String planSummary) {
        this.operation = operation;
        this.plans = List.copyOf(plans);
        this.analysis = analysis;
        this.planSummary = planSummary;
    }

    public OperationId getOperation() {
        return operation;
    }

    public List<QueryPlan> getPlans() {
        return plans;
    }

    public Optional<QueryPlan> plan(PlanRole role) {
        return plans.stream().filter(plan -> plan.getRole() == role).findFirst();
    }

    public AnalysisSpec getAnalysis() {
        return analysis;
    }

    public String getPlanSummary() {
        return planSummary;
    }
}
