package org.influence.analytics.enrichment.model;

/**
 * Outcome of enriching one batch of rows. Failed rows kept their fallback image.
 */
public class EnrichmentReport {

    private final int attempted;
    private final int failed;

    public EnrichmentReport(int attempted, int failed) {
        this.attempted = attempted;
        this.failed = failed;
    }

    public static EnrichmentReport skipped() {
        return new EnrichmentReport(0, 0);
    }

    public int getAttempted() {
        return attempted;
    }

    public int getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "EnrichmentReport{attempted=" + attempted + ", failed=" + failed + "}";
    }
}
