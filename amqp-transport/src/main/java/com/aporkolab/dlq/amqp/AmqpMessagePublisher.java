package com.aporkolab.dlq.amqp;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import com.aporkolab.dlq.transport.Destination;
import com.aporkolab.dlq.transport.MessagePublishException;
import com.aporkolab.dlq.transport.MessagePublisher;

/**
 * Republishes retries to the exchange and routing key they were received on, as persistent messages.
 */
public class AmqpMessagePublisher implements MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(AmqpMessagePublisher.class);

    private final RabbitTemplate rabbitTemplate;

    public AmqpMessagePublisher(RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    @Override
    public void publish(byte[] body, Destination destination, Map<String, String> headers) {
        MessageProperties properties = new MessageProperties();
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        if (headers != null) {
            headers.forEach(properties::setHeader);
        }
        Message message = MessageBuilder.withBody(body).andProperties(properties).build();

        try {
            rabbitTemplate.send(destination.name(), destination.routingKey(), message);
            log.debug("Published to {}", destination);
        } catch (AmqpException e) {
            throw new MessagePublishException(destination,
                    "Failed to publish to " + destination + ": " + e.getMessage(), e);
        }
    }
}
