package com.aporkolab.dlq.transport;

import java.util.Objects;

/**
 * Where a message was delivered from and where a retry is republished to.
 *
 * @param name       Kafka topic or AMQP exchange
 * @param routingKey Kafka record key or AMQP routing key, may be null
 */
public record Destination(String name, String routingKey) {

    public Destination {
        Objects.requireNonNull(name, "name");
    }

    public static Destination of(String name) {
        return new Destination(name, null);
    }

    @Override
    public String toString() {
        return routingKey == null || routingKey.isEmpty() ? name : name + "/" + routingKey;
    }
}
