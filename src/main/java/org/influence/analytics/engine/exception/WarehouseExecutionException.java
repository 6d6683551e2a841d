package org.influence.analytics.engine.exception;

public class WarehouseExecutionException extends AnalyticsException {
    private final String planLabel;

    public WarehouseExecutionException(String planLabel, String message, Throwable cause) {
        super(ErrorKind.EXECUTION_ERROR, message, cause);
        this.planLabel = planLabel;
    }

    public String getPlanLabel() {
        return planLabel;
    }
}
