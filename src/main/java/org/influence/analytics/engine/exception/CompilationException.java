package org.influence.analytics.engine.exception;

import org.influence.analytics.query.model.OperationId;

public class CompilationException extends AnalyticsException {
    private final OperationId operation;

    public CompilationException(OperationId operation, String message) {
        super(ErrorKind.COMPILATION_ERROR, String.format("Cannot compile %s: %s", operation.getWireName(), message));
        this.operation = operation;
    }

    public OperationId getOperation() {
        return operation;
    }
}
