package com.aporkolab.dlq.transport;

import java.util.Map;

/**
 * A delivered message as seen by the retry engine.
 *
 * Implementations wrap a transport-specific delivery. Disposition is final:
 * exactly one of {@link #ack()} or {@link #nack(boolean)} is called per delivery.
 */
public interface InboundMessage {

    byte[] body();

    /**
     * Header view of the delivery, may be null.
     * May be immutable; writers must be prepared for {@link UnsupportedOperationException}.
     */
    Map<String, String> headers();

    Destination destination();

    /** Transport message id for logs, may be null. */
    default String messageId() {
        return null;
    }

    void ack();

    /**
     * @param requeue false hands the message to the broker's dead-letter route
     */
    void nack(boolean requeue);

    /** True once {@link #ack()} or {@link #nack(boolean)} has been called. */
    boolean isDisposed();
}
