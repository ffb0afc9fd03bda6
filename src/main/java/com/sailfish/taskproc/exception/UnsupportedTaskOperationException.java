package com.sailfish.taskproc.exception;

/**
 * Signals that a backend cannot perform the requested operation in the requested form,
 * e.g. a non-blocking submission against a backend that only has blocking I/O.
 * Never retried.
 */
public class UnsupportedTaskOperationException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    private final String backendType;
    private final String operation;

    public UnsupportedTaskOperationException(String backendType, String operation) {
        super("Backend '" + backendType + "' does not support " + operation);
        this.backendType = backendType;
        this.operation = operation;
    }

    public String getBackendType() {
        return backendType;
    }

    public String getOperation() {
        return operation;
    }
}
