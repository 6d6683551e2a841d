package org.influence.analytics.filter.model;

public enum EthnicCategory implements WireValue {
    EAST_ASIAN("East Asian"),
    SOUTHEAST_ASIAN("Southeast Asian"),
    SOUTH_ASIAN("South Asian"),
    WHITE("White"),
    BLACK("Black"),
    HISPANIC_LATINO("Hispanic/Latino"),
    MIDDLE_EASTERN("Middle Eastern"),
    MIXED("Mixed"),
    OTHER("Other");

    private final String wireValue;

    EthnicCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
