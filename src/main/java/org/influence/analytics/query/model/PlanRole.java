package org.influence.analytics.query.model;

/**
 * What a plan contributes when an operation compiles to more than one query.
 */
public enum PlanRole {
    PRIMARY("primary"),
    CURRENT_WINDOW("current"),
    PREVIOUS_WINDOW("previous"),
    TOTALS("totals");

    private final String label;

    PlanRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
