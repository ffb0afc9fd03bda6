package com.sailfish.taskproc.exception;

/**
 * Thrown by the adapter factory when no adapter implements the configured backend type.
 */
public class UnknownBackendException extends TaskProcessorException {

    private static final long serialVersionUID = 1L;

    private final String backendType;

    public UnknownBackendException(String backendType, Class<?> configType) {
        super("Unknown backend config type: '" + backendType + "' (" + configType.getName() + ")");
        this.backendType = backendType;
    }

    public String getBackendType() {
        return backendType;
    }
}
