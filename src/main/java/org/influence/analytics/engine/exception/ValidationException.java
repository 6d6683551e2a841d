package org.influence.analytics.engine.exception;

public class ValidationException extends AnalyticsException {
    private final String parameter;

    public ValidationException(String parameter, String message) {
        super(ErrorKind.VALIDATION_ERROR, String.format("Invalid parameter '%s': %s", parameter, message));
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
