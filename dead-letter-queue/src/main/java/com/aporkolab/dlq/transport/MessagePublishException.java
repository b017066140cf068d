package com.aporkolab.dlq.transport;

/**
 * Thrown when a message could not be published.
 */
public class MessagePublishException extends RuntimeException {

    private final Destination destination;

    public MessagePublishException(Destination destination, String message) {
        super(message);
        this.destination = destination;
    }

    public MessagePublishException(Destination destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }

    public Destination getDestination() {
        return destination;
    }
}
