package org.influence.analytics.engine.exception;

public class ExportException extends AnalyticsException {
    private final String logicalName;

    public ExportException(String logicalName, String message, Throwable cause) {
        super(ErrorKind.EXPORT_ERROR, String.format("Export of %s failed: %s", logicalName, message), cause);
        this.logicalName = logicalName;
    }

    public String getLogicalName() {
        return logicalName;
    }
}
