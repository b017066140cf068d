package com.aporkolab.dlq.middleware;

import com.aporkolab.dlq.transport.InboundMessage;

/**
 * Business logic invoked for a delivered message.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    T handle(InboundMessage message) throws Exception;
}
