package org.influence.analytics.filter.model;

public enum PersonalColor implements WireValue {
    SPRING_WARM("Spring Warm"),
    SUMMER_COOL("Summer Cool"),
    AUTUMN_WARM("Autumn Warm"),
    WINTER_COOL("Winter Cool");

    private final String wireValue;

    PersonalColor(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
