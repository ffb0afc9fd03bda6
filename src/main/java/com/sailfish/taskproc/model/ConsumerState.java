package com.sailfish.taskproc.model;

/**
 * Lifecycle of the background consumer owned by an adapter.
 */
public enum ConsumerState {
    STOPPED,
    RUNNING,
    /**
     * Stop signal sent, waiting (bounded) for the consumer thread to exit.
     */
    STOPPING
}
