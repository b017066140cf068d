package com.aporkolab.dlq.middleware;

import java.util.Map;

import org.slf4j.MDC;

import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.InboundMessage;

/**
 * Puts delivery details into the MDC for the duration of one handler invocation
 * and restores the previous MDC on close.
 *
 * <pre>
 * try (var ctx = DeliveryLogContext.open(message, state)) {
 *     log.info("Handling"); // includes dlqDestination and retryCount
 * }
 * </pre>
 */
public final class DeliveryLogContext implements AutoCloseable {

    public static final String DESTINATION_KEY = "dlqDestination";
    public static final String RETRY_COUNT_KEY = "retryCount";
    public static final String MESSAGE_ID_KEY = "messageId";

    private final Map<String, String> previousContext;

    private DeliveryLogContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    public static DeliveryLogContext open(InboundMessage message, RetryState state) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (message.destination() != null) {
            MDC.put(DESTINATION_KEY, message.destination().toString());
        }
        MDC.put(RETRY_COUNT_KEY, String.valueOf(state.getCount()));
        if (message.messageId() != null) {
            MDC.put(MESSAGE_ID_KEY, message.messageId());
        }
        return new DeliveryLogContext(previous);
    }

    @Override
    public void close() {
        if (previousContext != null) {
            MDC.setContextMap(previousContext);
        } else {
            MDC.clear();
        }
    }
}
