package org.influence.analytics.filter.model;

public enum BeautyContentType implements WireValue {
    MAKEUP_TUTORIAL("Makeup Tutorial"),
    PRODUCT_REVIEW("Product Review"),
    SKINCARE_ROUTINE("Skincare Routine"),
    GRWM("GRWM"),
    UNBOXING("Unboxing"),
    BEFORE_AFTER("Before After"),
    HAUL("Haul"),
    LOOK_RECREATION("Look Recreation");

    private final String wireValue;

    BeautyContentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
