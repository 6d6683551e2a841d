package org.influence.analytics.aggregation.model;

/**
 * Percentage share of a count against a total taken from the totals result set.
 * When {@code groupColumn} is set, totals are matched per group (for example per brand).
 */
public final class Distribution {

    private final String countColumn;
    private final String totalColumn;
    private final String outputColumn;
    private final String groupColumn;

    public Distribution(String countColumn, String totalColumn, String outputColumn, String groupColumn) {
        this.countColumn = countColumn;
        this.totalColumn = totalColumn;
        this.outputColumn = outputColumn;
        this.groupColumn = groupColumn;
    }

    public String getCountColumn() {
        return countColumn;
    }

    public String getTotalColumn() {
        return totalColumn;
    }

    public String getOutputColumn() {
        return outputColumn;
    }

    public String getGroupColumn() {
        return groupColumn;
    }
}
