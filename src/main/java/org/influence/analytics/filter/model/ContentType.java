package org.influence.analytics.filter.model;

/**
 * Which content tables a content operation reads.
 */
public enum ContentType implements WireValue {
    ALL("all"),
    MEDIA("media"),
    REELS("reels");

    private final String wireValue;

    ContentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
