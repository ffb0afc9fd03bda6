package com.sailfish.taskproc.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a failed handler invocation is redelivered, and after which delay.
 */
public interface RetryStrategy {

    /**
     * @param retries redeliveries already made for the task; 0 after the first failed attempt.
     * @return false once the retry limit is reached.
     */
    boolean shouldRetry(int retries);

    /**
     * @param retries redeliveries already made for the task.
     * @return how long the next delivery stays invisible, or empty if the task must fail now.
     */
    Optional<Duration> calculateNextRetryDelay(int retries);

}
