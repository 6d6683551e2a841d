package org.influence.analytics.aggregation.service;

/**
 * Engagement rate: {@code (primary + secondary) / max(followers, 1) * 100}.
 * The same formula is used on rows in memory and inside generated SQL.
 */
public final class EngagementRate {

    private EngagementRate() {
    }

    /**
     * Reaction inputs may be averages, so fractions are kept until the final rounding.
     */
    public static double of(double primaryReactions, double secondaryReactions, double followers) {
        return (primaryReactions + secondaryReactions) * 100.0 / Math.max(followers, 1.0);
    }

    /**
     * ClickHouse expression computing the rate from three column expressions.
     */
    public static String sqlExpression(String primaryColumn, String secondaryColumn, String followersColumn) {
        return "(" + primaryColumn + " + " + secondaryColumn + ") * 100.0 / greatest(" + followersColumn + ", 1)";
    }
}
