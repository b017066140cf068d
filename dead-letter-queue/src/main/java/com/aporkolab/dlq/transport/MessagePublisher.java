package com.aporkolab.dlq.transport;

import java.util.Map;

/**
 * Publishes a message to a destination. Returns only once the broker accepted it.
 */
@FunctionalInterface
public interface MessagePublisher {

    /**
     * @throws MessagePublishException if the broker did not accept the message
     */
    void publish(byte[] body, Destination destination, Map<String, String> headers);
}
