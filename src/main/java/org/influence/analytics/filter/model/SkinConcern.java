package org.influence.analytics.filter.model;

public enum SkinConcern implements WireValue {
    ACNE("Acne"),
    PORES("Pores"),
    WRINKLES("Wrinkles"),
    DULLNESS("Dullness"),
    REDNESS("Redness"),
    HYPERPIGMENTATION("Hyperpigmentation"),
    DRYNESS("Dryness"),
    OILINESS("Oiliness"),
    DARK_CIRCLES("Dark Circles"),
    SENSITIVITY("Sensitivity");

    private final String wireValue;

    SkinConcern(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
