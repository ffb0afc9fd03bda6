package com.sailfish.taskproc.exception;

/**
 * Thrown at construction when an adapter is given a backend configuration variant it does not implement.
 */
public class ConfigMismatchException extends TaskProcessorException {

    private static final long serialVersionUID = 1L;

    private final Class<?> expectedType;
    private final Class<?> actualType;

    public ConfigMismatchException(Class<?> expectedType, Class<?> actualType) {
        super("Backend config must be an instance of " + expectedType.getName()
                + " but was " + (actualType == null ? "null" : actualType.getName()));
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
