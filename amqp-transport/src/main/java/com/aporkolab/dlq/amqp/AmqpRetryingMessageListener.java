package com.aporkolab.dlq.amqp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import com.aporkolab.dlq.middleware.MessageHandler;
import com.aporkolab.dlq.middleware.MiddlewareChain;
import com.rabbitmq.client.Channel;

/**
 * Bridges a Spring AMQP listener container to the middleware chain.
 *
 * Requires {@code AcknowledgeMode.MANUAL}. Handler failures are logged and not
 * rethrown: the chain has already settled the delivery.
 */
public class AmqpRetryingMessageListener implements ChannelAwareMessageListener {

    private static final Logger log = LoggerFactory.getLogger(AmqpRetryingMessageListener.class);

    private final MiddlewareChain chain;
    private final MessageHandler<?> handler;

    public AmqpRetryingMessageListener(MiddlewareChain chain, MessageHandler<?> handler) {
        this.chain = chain;
        this.handler = handler;
    }

    @Override
    public void onMessage(Message message, Channel channel) {
        AmqpInboundMessage inbound = new AmqpInboundMessage(message, channel);
        try {
            chain.dispatch(inbound, handler);
        } catch (Exception e) {
            log.debug("Handler failed for delivery {} from {}, disposition already applied: {}",
                    message.getMessageProperties().getDeliveryTag(), inbound.destination(), e.getMessage());
        }
    }
}
