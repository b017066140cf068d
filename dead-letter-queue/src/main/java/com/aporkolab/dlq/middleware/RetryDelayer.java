package com.aporkolab.dlq.middleware;

import java.time.Duration;

/**
 * Waits out the delay before a retry is republished.
 * Runs on the delivering thread; on Kafka that thread also serves the consumer's other partitions.
 */
@FunctionalInterface
public interface RetryDelayer {

    /**
     * @return true if the full delay elapsed, false if the wait was cancelled
     */
    boolean await(Duration delay);
}
