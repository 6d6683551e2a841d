package org.influence.analytics.engine.exception;

/**
 * Classification of failures surfaced to the calling dispatcher.
 */
public enum ErrorKind {
    VALIDATION_ERROR("ValidationError"),
    COMPILATION_ERROR("CompilationError"),
    EXECUTION_ERROR("ExecutionError"),
    EXPORT_ERROR("ExportError"),
    PARTIAL_ENRICHMENT_ERROR("PartialEnrichmentError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
