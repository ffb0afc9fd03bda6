package com.sailfish.taskproc.service.impl;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one consumer, published with its heartbeat.
 */
class ConsumerStats {

    final AtomicInteger active = new AtomicInteger();
    final AtomicLong processed = new AtomicLong();
    final AtomicLong succeeded = new AtomicLong();
    final AtomicLong failed = new AtomicLong();
    final AtomicLong retried = new AtomicLong();
}
