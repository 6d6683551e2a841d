package org.influence.analytics.filter.model;

public enum Lifestage implements WireValue {
    STUDENT("Student"),
    YOUNG_PROFESSIONAL("Young Professional"),
    NEWLYWED("Newlywed"),
    PARENT_YOUNG_CHILDREN("Parent of Young Children"),
    PARENT_TEENS("Parent of Teens"),
    EMPTY_NESTER("Empty Nester"),
    RETIRED("Retired");

    private final String wireValue;

    Lifestage(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
