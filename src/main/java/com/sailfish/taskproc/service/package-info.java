/**
 * The adapter contract, {@link com.sailfish.taskproc.service.TaskProcessorAdapter}, through which
 * callers submit, query and cancel tasks and manage the consumer executing them.
 */
package com.sailfish.taskproc.service;
