package org.influence.analytics.engine.exception;

/**
 * Base type for every failure the engine knows how to classify.
 */
public abstract class AnalyticsException extends RuntimeException {

    private final ErrorKind errorKind;

    protected AnalyticsException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected AnalyticsException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
