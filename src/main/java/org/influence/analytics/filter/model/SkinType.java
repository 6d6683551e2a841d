package org.influence.analytics.filter.model;

public enum SkinType implements WireValue {
    OILY("Oily"),
    DRY("Dry"),
    COMBINATION("Combination"),
    NORMAL("Normal"),
    SENSITIVE("Sensitive");

    private final String wireValue;

    SkinType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
