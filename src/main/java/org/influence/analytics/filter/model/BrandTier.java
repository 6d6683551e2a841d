package org.influence.analytics.filter.model;

/**
 * Price segment of the brands an influencer gravitates to.
 */
public enum BrandTier implements WireValue {
    LUXURY("Luxury"),
    PREMIUM("Premium"),
    MASSTIGE("Masstige"),
    MASS("Mass"),
    DRUGSTORE("Drugstore");

    private final String wireValue;

    BrandTier(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
