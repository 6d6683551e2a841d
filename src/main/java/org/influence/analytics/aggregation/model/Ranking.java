package org.influence.analytics.aggregation.model;

/**
 * Assigns a 1-based position to rows in their existing order, restarting whenever the
 * partition column changes value.
 */
public final class Ranking {

    private final String rankColumn;
    private final String partitionColumn;
    private final String presenceColumn;

    /**
     * @param rankColumn      column receiving the rank
     * @param partitionColumn column whose value change restarts the rank, or null for a global rank
     * @param presenceColumn  rows where this column is null (filler rows) receive no rank
     */
    public Ranking(String rankColumn, String partitionColumn, String presenceColumn) {
        this.rankColumn = rankColumn;
        this.partitionColumn = partitionColumn;
        this.presenceColumn = presenceColumn;
    }

    public String getRankColumn() {
        return rankColumn;
    }

    public String getPartitionColumn() {
        return partitionColumn;
    }

    public String getPresenceColumn() {
        return presenceColumn;
    }
}
