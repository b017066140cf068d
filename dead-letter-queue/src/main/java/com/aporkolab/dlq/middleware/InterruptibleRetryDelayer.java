package com.aporkolab.dlq.middleware;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks the delivery thread for the retry delay.
 *
 * Every pending wait returns early once {@link #close()} is called, so shutdown
 * is never held up by sleeping retries. Thread interruption also ends the wait;
 * the interrupt flag is restored.
 */
public class InterruptibleRetryDelayer implements RetryDelayer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InterruptibleRetryDelayer.class);

    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    @Override
    public boolean await(Duration delay) {
        if (isClosed()) {
            return false;
        }
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            boolean shutdown = shutdownSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
            if (shutdown) {
                log.info("Retry wait cancelled by shutdown after less than {} ms", delay.toMillis());
            }
            return !shutdown;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Retry wait interrupted");
            return false;
        }
    }

    public boolean isClosed() {
        return shutdownSignal.getCount() == 0;
    }

    @Override
    public void close() {
        shutdownSignal.countDown();
    }
}
