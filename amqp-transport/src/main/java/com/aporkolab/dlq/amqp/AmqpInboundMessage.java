package com.aporkolab.dlq.amqp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.transport.AbstractInboundMessage;
import com.aporkolab.dlq.transport.Destination;
import com.rabbitmq.client.Channel;

/**
 * A RabbitMQ delivery consumed with manual acknowledgment.
 *
 * A reject without requeue lets the queue's dead-letter exchange take over.
 * Headers are a mutable copy, so reason stamping never touches the delivered message.
 */
public class AmqpInboundMessage extends AbstractInboundMessage {

    private final Message message;
    private final Channel channel;
    private final Map<String, String> headers;

    public AmqpInboundMessage(Message message, Channel channel) {
        this.message = message;
        this.channel = channel;
        this.headers = toStringHeaders(message.getMessageProperties());
    }

    private static Map<String, String> toStringHeaders(MessageProperties properties) {
        Map<String, String> headers = new LinkedHashMap<>();
        properties.getHeaders().forEach((key, value) -> {
            if (value instanceof byte[] bytes) {
                headers.put(key, new String(bytes, StandardCharsets.UTF_8));
            } else if (value != null) {
                headers.put(key, value.toString());
            }
        });
        Date timestamp = properties.getTimestamp();
        if (!headers.containsKey(RetryHeaders.FIRST_PUBLISHED_AT) && timestamp != null) {
            headers.put(RetryHeaders.FIRST_PUBLISHED_AT, String.valueOf(timestamp.getTime()));
        }
        return headers;
    }

    @Override
    public byte[] body() {
        return message.getBody();
    }

    @Override
    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public Destination destination() {
        MessageProperties properties = message.getMessageProperties();
        String exchange = properties.getReceivedExchange();
        return new Destination(exchange == null ? "" : exchange, properties.getReceivedRoutingKey());
    }

    @Override
    public String messageId() {
        return message.getMessageProperties().getMessageId();
    }

    public Message message() {
        return message;
    }

    @Override
    protected void doAck() {
        try {
            channel.basicAck(deliveryTag(), false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ack delivery " + deliveryTag(), e);
        }
    }

    @Override
    protected void doNack(boolean requeue) {
        try {
            channel.basicNack(deliveryTag(), false, requeue);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to nack delivery " + deliveryTag(), e);
        }
    }

    private long deliveryTag() {
        return message.getMessageProperties().getDeliveryTag();
    }
}
