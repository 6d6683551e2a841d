package org.influence.analytics.query.model;

public enum AggregationKind {
    /** Row-level profile search, no grouping. */
    RAW_SEARCH,
    /** Grouped statistics over one time window. */
    SINGLE_WINDOW,
    /** Current window compared with the equal-length window before it. */
    TWO_WINDOW,
    /** One record per requested entity (brand, region), zero-filled when absent. */
    MULTI_ENTITY
}
