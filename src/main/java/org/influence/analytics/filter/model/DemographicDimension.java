package org.influence.analytics.filter.model;

/**
 * Scalar general-profile columns the demographic breakdown can group by.
 */
public enum DemographicDimension implements WireValue {
    GENDER("gender"),
    AGE_RANGE("age_range"),
    COLLABORATION_TIER("collaboration_tier"),
    OCCUPATION("occupation");

    private final String wireValue;

    DemographicDimension(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }

    public String getColumn() {
        return wireValue;
    }
}
