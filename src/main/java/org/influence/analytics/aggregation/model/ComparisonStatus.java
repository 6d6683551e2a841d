package org.influence.analytics.aggregation.model;

public enum ComparisonStatus {
    /** Present now, absent in the previous window: no finite growth rate exists. */
    NEW("new"),
    COMPARED("compared");

    private final String wireValue;

    ComparisonStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
