package org.influence.analytics.aggregation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current and previous counts for one key, with its growth classification.
 */
public final class ComparisonRecord {

    private final String key;
    private final long currentCount;
    private final long previousCount;
    private final ComparisonStatus status;
    private final Double growthRate;
    private final Map<String, Object> attributes;

    private ComparisonRecord(String key, long currentCount, long previousCount, ComparisonStatus status,
                             Double growthRate, Map<String, Object> attributes) {
        this.key = key;
        this.currentCount = currentCount;
        this.previousCount = previousCount;
        this.status = status;
        this.growthRate = growthRate;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Classify a key. Returns null when both counts are zero, since such a key carries no signal.
     */
    public static ComparisonRecord of(String key, long currentCount, long previousCount,
                                      Map<String, Object> attributes) {
        if (currentCount <= 0 && previousCount <= 0) {
            return null;
        }
        if (previousCount <= 0) {
            return new ComparisonRecord(key, currentCount, 0, ComparisonStatus.NEW, null, attributes);
        }
        double growth = (double) currentCount / previousCount;
        return new ComparisonRecord(key, currentCount, previousCount, ComparisonStatus.COMPARED, growth, attributes);
    }

    public String getKey() {
        return key;
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public long getPreviousCount() {
        return previousCount;
    }

    public ComparisonStatus getStatus() {
        return status;
    }

    public boolean isNew() {
        return status == ComparisonStatus.NEW;
    }

    /**
     * Unrounded current/previous ratio; null for {@link ComparisonStatus#NEW} records.
     */
    public Double getGrowthRate() {
        return growthRate;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return key + " " + currentCount + "/" + previousCount + " " + status.getWireValue();
    }
}
