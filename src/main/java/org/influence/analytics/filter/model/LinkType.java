package org.influence.analytics.filter.model;

public enum LinkType implements WireValue {
    ALL("all"),
    SNS("sns"),
    SHOPPING("shopping"),
    CONTACT("contact");

    private final String wireValue;

    LinkType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
