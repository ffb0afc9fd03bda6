package com.sailfish.taskproc.service.impl;

/**
 * Body of a consumer thread, stoppable from the supervising thread.
 */
public interface ConsumerLoop extends Runnable {

    /**
     * Asks the loop to finish; returns immediately.
     */
    void requestStop();
}
