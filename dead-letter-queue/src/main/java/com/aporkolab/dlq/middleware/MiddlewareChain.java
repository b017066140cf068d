package com.aporkolab.dlq.middleware;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.dlq.transport.InboundMessage;

/**
 * Ordered middleware composed explicitly at startup. The first middleware is outermost.
 *
 * Usage:
 * <pre>
 * MiddlewareChain chain = MiddlewareChain.of(retryMiddleware);
 * chain.dispatch(message, orderHandler);
 * </pre>
 */
public final class MiddlewareChain {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareChain.class);

    private final List<MessageMiddleware> middlewares;

    private MiddlewareChain(List<MessageMiddleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
    }

    public static MiddlewareChain of(MessageMiddleware... middlewares) {
        return new MiddlewareChain(List.of(middlewares));
    }

    public static MiddlewareChain of(List<MessageMiddleware> middlewares) {
        return new MiddlewareChain(middlewares);
    }

    /**
     * Wraps {@code handler} in every middleware of this chain.
     */
    public <T> MessageHandler<T> wrap(MessageHandler<T> handler) {
        MessageHandler<T> current = handler;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            MessageMiddleware middleware = middlewares.get(i);
            MessageHandler<T> next = current;
            current = message -> middleware.handle(message, next);
        }
        return current;
    }

    /**
     * Runs the wrapped handler and settles the delivery if no middleware did:
     * ack on success, nack with requeue on failure so the broker redelivers it.
     * The failure is rethrown either way.
     */
    public <T> T dispatch(InboundMessage message, MessageHandler<T> handler) throws Exception {
        T result;
        try {
            result = wrap(handler).handle(message);
        } catch (Exception e) {
            if (!message.isDisposed()) {
                log.debug("Failure left message {} unsettled, requeueing", message.messageId());
                message.nack(true);
            }
            throw e;
        }
        if (!message.isDisposed()) {
            message.ack();
        }
        return result;
    }

    public List<MessageMiddleware> getMiddlewares() {
        return middlewares;
    }
}
