package org.influence.analytics.query.catalog;

import org.influence.analytics.query.model.JoinType;

/**
 * When a joinable table enters a plan, and how it is joined.
 */
public enum JoinRequirement {
    ALWAYS_INNER(JoinType.INNER, false),
    ALWAYS_LEFT(JoinType.LEFT, false),
    /** Only when a beauty sub-filter is present. */
    ON_SPECIALIZED_FILTER(JoinType.INNER, true);

    private final JoinType joinType;
    private final boolean conditional;

    JoinRequirement(JoinType joinType, boolean conditional) {
        this.joinType = joinType;
        this.conditional = conditional;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public boolean isConditional() {
        return conditional;
    }
}
