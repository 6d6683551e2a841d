package org.influence.analytics.filter.model;

/**
 * Ingredient family analysed by the ingredient trend operation, with the beauty profile
 * array it reads and the interest area an influencer must declare to be counted.
 */
public enum BeautyCategory implements WireValue {
    SKINCARE("skincare", "skincare_ingredients", BeautyInterestArea.SKINCARE),
    MAKEUP("makeup", "makeup_items", BeautyInterestArea.MAKEUP),
    HAIRCARE("haircare", "hair_items", BeautyInterestArea.HAIR_CARE);

    private final String wireValue;
    private final String itemColumn;
    private final BeautyInterestArea interestArea;

    BeautyCategory(String wireValue, String itemColumn, BeautyInterestArea interestArea) {
        this.wireValue = wireValue;
        this.itemColumn = itemColumn;
        this.interestArea = interestArea;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }

    public String getItemColumn() {
        return itemColumn;
    }

    public BeautyInterestArea getInterestArea() {
        return interestArea;
    }
}
