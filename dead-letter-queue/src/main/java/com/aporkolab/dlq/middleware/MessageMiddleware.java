package com.aporkolab.dlq.middleware;

import com.aporkolab.dlq.transport.InboundMessage;

/**
 * Interceptor around handler invocation. Implementations call {@code next}
 * at most once and decide what to do with its result or failure.
 */
public interface MessageMiddleware {

    <T> T handle(InboundMessage message, MessageHandler<T> next) throws Exception;
}
