/**
 * Immutable configuration: the routing queue and retry limit in
 * {@link com.sailfish.taskproc.config.TaskProcessorConfig}, the broker specifics in one
 * {@link com.sailfish.taskproc.config.BackendConfig} variant.
 */
package com.sailfish.taskproc.config;
