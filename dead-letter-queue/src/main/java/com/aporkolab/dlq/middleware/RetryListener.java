package com.aporkolab.dlq.middleware;

import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.InboundMessage;

/**
 * Observer of retry engine decisions, for metrics and alerting.
 *
 * Callbacks run on the delivery thread. Exceptions thrown here are logged
 * and never affect message disposition.
 */
public interface RetryListener {

    /** A message that had been retried before was handled successfully. */
    default void onSuccess(InboundMessage message, RetryState state) {
    }

    /** The message was republished for another attempt. */
    default void onRetryScheduled(InboundMessage message, RetryDecision decision, Throwable error) {
    }

    /** The message was rejected to the dead-letter route. */
    default void onDeadLettered(InboundMessage message, RetryDecision decision, RetryState state, Throwable error) {
    }

    /** Republishing a retry failed; the original was rejected without requeue. */
    default void onRepublishFailed(InboundMessage message, RetryDecision decision, Exception publishError) {
    }

    /** The retry wait was cut short by shutdown or interruption; the message will be redelivered. */
    default void onRetryCancelled(InboundMessage message, RetryDecision decision) {
    }

    /** A dead-lettered message was replayed to its original destination. */
    default void onReplay(InboundMessage message, boolean success) {
    }
}
