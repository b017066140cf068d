package com.aporkolab.dlq.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for transport adapters. Guarantees a single disposition per delivery:
 * the first ack/nack wins, later calls are ignored.
 */
public abstract class AbstractInboundMessage implements InboundMessage {

    private static final Logger log = LoggerFactory.getLogger(AbstractInboundMessage.class);

    private final AtomicBoolean disposed = new AtomicBoolean(false);

    @Override
    public final void ack() {
        if (disposed.compareAndSet(false, true)) {
            doAck();
        } else {
            log.debug("Message {} already disposed, ignoring ack", messageId());
        }
    }

    @Override
    public final void nack(boolean requeue) {
        if (disposed.compareAndSet(false, true)) {
            doNack(requeue);
        } else {
            log.debug("Message {} already disposed, ignoring nack", messageId());
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    protected abstract void doAck();

    protected abstract void doNack(boolean requeue);
}
