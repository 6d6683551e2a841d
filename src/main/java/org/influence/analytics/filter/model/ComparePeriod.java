package org.influence.analytics.filter.model;

/**
 * Named window lengths for two-window trend comparisons.
 */
public enum ComparePeriod implements WireValue {
    TWO_WEEKS("2weeks", 14),
    ONE_MONTH("1month", 30),
    THREE_MONTHS("3months", 90);

    private final String wireValue;
    private final int days;

    ComparePeriod(String wireValue, int days) {
        this.wireValue = wireValue;
        this.days = days;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }

    public int getDays() {
        return days;
    }
}
