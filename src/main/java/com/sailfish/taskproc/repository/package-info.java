/**
 * Data access for the two external stores: the result store
 * ({@link com.sailfish.taskproc.repository.TaskResultRepository}) and the broker
 * ({@link com.sailfish.taskproc.repository.BrokerRepository}), each with a JPA implementation.
 */
package com.sailfish.taskproc.repository;
