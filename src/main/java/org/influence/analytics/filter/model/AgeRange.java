package org.influence.analytics.filter.model;

/**
 * Age brackets as assigned by the profile classifier.
 */
public enum AgeRange implements WireValue {
    UNDER_18("Under 18"),
    AGE_18_24("18-24"),
    AGE_25_34("25-34"),
    AGE_35_44("35-44"),
    AGE_45_54("45-54"),
    AGE_55_PLUS("55+");

    private final String wireValue;

    AgeRange(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
