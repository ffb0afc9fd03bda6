/**
 * Broker-agnostic task processing: handlers are registered with a
 * {@link com.sailfish.taskproc.service.TaskProcessorAdapter}, tasks are enqueued by name
 * and executed by the adapter's background consumer.
 */
package com.sailfish.taskproc;
