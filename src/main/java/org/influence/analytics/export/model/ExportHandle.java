package org.influence.analytics.export.model;

import java.time.Instant;

/**
 * Where a written export lives and how long its download link stays valid.
 */
public class ExportHandle {

    private final String objectName;
    private final String url;
    private final Instant expiresAt;

    public ExportHandle(String objectName, String url, Instant expiresAt) {
        this.objectName = objectName;
        this.url = url;
        this.expiresAt = expiresAt;
    }

    public String getObjectName() {
        return objectName;
    }

    /**
     * Download link, or null when the sink does not publish one.
     */
    public String getUrl() {
        return url;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "ExportHandle{objectName='" + objectName + "', expiresAt=" + expiresAt + "}";
    }
}
