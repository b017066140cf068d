package com.aporkolab.dlq.kafka;

import java.time.Duration;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;

import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.middleware.MessageHandler;
import com.aporkolab.dlq.middleware.MiddlewareChain;

/**
 * Bridges a Spring Kafka listener container to the middleware chain.
 *
 * Requires {@code AckMode.MANUAL_IMMEDIATE}. Handler failures are logged and not
 * rethrown: the chain has already settled the record, and the container's error
 * handler would otherwise seek back and redeliver it a second time.
 *
 * The retry wait runs on the container's consumer thread, so it stalls every partition
 * that thread owns. The longest wait must stay below {@code max.poll.interval.ms} or the
 * consumer is evicted mid-wait, its commit fails and the record is redelivered while the
 * republished copy is already on the topic. Check with
 * {@link #requireWaitWithinPollInterval(DlqConfig, Duration)} when wiring the container,
 * and raise container concurrency to keep other partitions moving.
 *
 * Usage:
 * <pre>
 * container.setupMessageListener(new KafkaRetryingMessageListener(chain, orderHandler, forwarder));
 * </pre>
 */
public class KafkaRetryingMessageListener implements AcknowledgingMessageListener<String, String> {

    private static final Logger log = LoggerFactory.getLogger(KafkaRetryingMessageListener.class);

    private final MiddlewareChain chain;
    private final MessageHandler<?> handler;
    private final KafkaDeadLetterForwarder forwarder;

    public KafkaRetryingMessageListener(MiddlewareChain chain, MessageHandler<?> handler,
                                        KafkaDeadLetterForwarder forwarder) {
        this.chain = chain;
        this.handler = handler;
        this.forwarder = forwarder;
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        KafkaInboundMessage message = KafkaInboundMessage.of(record, acknowledgment, forwarder);
        try {
            chain.dispatch(message, handler);
        } catch (Exception e) {
            log.debug("Handler failed for {}, disposition already applied: {}", message.messageId(), e.getMessage());
        }
    }

    /**
     * Longest retry wait the config allows: {@code maxDelay}, scaled by {@code jitterMax} when jitter is on.
     */
    public static Duration longestWait(DlqConfig config) {
        double factor = config.isJitterEnabled() ? Math.max(1.0, config.getJitterMax()) : 1.0;
        return Duration.ofMillis((long) Math.ceil(config.getMaxDelay().toMillis() * factor));
    }

    /**
     * @throws IllegalArgumentException if a retry wait could outlast the consumer's poll interval
     */
    public static void requireWaitWithinPollInterval(DlqConfig config, Duration maxPollInterval) {
        Duration longest = longestWait(config);
        if (longest.compareTo(maxPollInterval) >= 0) {
            throw new IllegalArgumentException("maxDelay with jitter (" + longest.toMillis()
                    + "ms) must stay below max.poll.interval.ms (" + maxPollInterval.toMillis() + "ms)");
        }
    }
}
