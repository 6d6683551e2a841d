package org.influence.analytics.engine.exception;

public class PartialEnrichmentException extends AnalyticsException {
    private final String userId;

    public PartialEnrichmentException(String userId, String message, Throwable cause) {
        super(ErrorKind.PARTIAL_ENRICHMENT_ERROR, String.format("Enrichment for user %s failed: %s", userId, message), cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
