package org.influence.analytics.filter.model;

public enum Gender implements WireValue {
    FEMALE("Female"),
    MALE("Male"),
    OTHER("Other");

    private final String wireValue;

    Gender(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
