package org.influence.analytics.filter.model;

/**
 * Brand-readiness tier of an influencer.
 */
public enum CollaborationTier implements WireValue {
    READY_PREMIUM("Ready - Premium"),
    READY_PROFESSIONAL("Ready - Professional"),
    READY_EMERGING("Ready - Emerging"),
    POTENTIAL("Potential"),
    NOT_READY("Not Ready");

    private final String wireValue;

    CollaborationTier(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
