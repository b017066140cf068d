package com.aporkolab.dlq.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.aporkolab.dlq.transport.Destination;
import com.aporkolab.dlq.transport.MessagePublishException;
import com.aporkolab.dlq.transport.MessagePublisher;

/**
 * Republishes retries to their original topic, keyed by the original record key.
 *
 * Sends are synchronous: the original record is only acknowledged after the broker
 * confirmed the retry copy.
 */
public class KafkaMessagePublisher implements MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessagePublisher.class);
    private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(10);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Duration sendTimeout;

    public KafkaMessagePublisher(KafkaTemplate<String, String> kafkaTemplate) {
        this(kafkaTemplate, DEFAULT_SEND_TIMEOUT);
    }

    public KafkaMessagePublisher(KafkaTemplate<String, String> kafkaTemplate, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void publish(byte[] body, Destination destination, Map<String, String> headers) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                destination.name(),
                destination.routingKey(),
                new String(body, StandardCharsets.UTF_8)
        );
        KafkaHeaders.copyInto(headers, record.headers());
        send(record, destination);
    }

    SendResult<String, String> send(ProducerRecord<String, String> record, Destination destination) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(record)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published to {}: partition={}, offset={}", destination,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagePublishException(destination, "Interrupted while publishing to " + destination, e);
        } catch (ExecutionException e) {
            throw new MessagePublishException(destination,
                    "Failed to publish to " + destination + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new MessagePublishException(destination,
                    "Timed out after " + sendTimeout.toMillis() + " ms publishing to " + destination, e);
        }
    }
}
