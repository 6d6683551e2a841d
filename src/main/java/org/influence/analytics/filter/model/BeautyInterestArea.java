package org.influence.analytics.filter.model;

public enum BeautyInterestArea implements WireValue {
    SKINCARE("Skincare"),
    MAKEUP("Makeup"),
    HAIR_CARE("Hair Care"),
    FRAGRANCE("Fragrance"),
    NAIL("Nail"),
    BODY_CARE("Body Care");

    private final String wireValue;

    BeautyInterestArea(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
