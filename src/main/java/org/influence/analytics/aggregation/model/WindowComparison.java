package org.influence.analytics.aggregation.model;

/**
 * How the current and previous window result sets are aligned and filtered.
 */
public final class WindowComparison {

    private final String keyColumn;
    private final String countColumn;
    private final Double minGrowthRate;
    private final Long minCurrentCount;
    private final int resultLimit;

    public WindowComparison(String keyColumn, String countColumn, Double minGrowthRate, Long minCurrentCount,
                            int resultLimit) {
        this.keyColumn = keyColumn;
        this.countColumn = countColumn;
        this.minGrowthRate = minGrowthRate;
        this.minCurrentCount = minCurrentCount;
        this.resultLimit = resultLimit;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public String getCountColumn() {
        return countColumn;
    }

    public Double getMinGrowthRate() {
        return minGrowthRate;
    }

    public Long getMinCurrentCount() {
        return minCurrentCount;
    }

    public int getResultLimit() {
        return resultLimit;
    }
}
