/**
 * Contains the retry policy applied to failing task handlers:
 * {@link com.sailfish.taskproc.retry.RetryStrategy} and the default
 * {@link com.sailfish.taskproc.retry.ExponentialBackoffRetryStrategy}.
 */
package com.sailfish.taskproc.retry;
