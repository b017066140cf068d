package com.aporkolab.dlq.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.support.Acknowledgment;

import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.transport.AbstractInboundMessage;
import com.aporkolab.dlq.transport.Destination;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * A Kafka record delivered with manual acknowledgment.
 *
 * Dispositions map to:
 * - ack: commit the offset
 * - nack with requeue: seek back so the record is redelivered
 * - nack without requeue: forward to the DLQ topic, then commit
 *
 * The record timestamp seeds {@code x-first-published-ms} when the producer did not set it.
 */
public class KafkaInboundMessage extends AbstractInboundMessage {

    private static final Logger log = LoggerFactory.getLogger(KafkaInboundMessage.class);

    private final ConsumerRecord<String, String> record;
    private final Acknowledgment acknowledgment;
    private final KafkaDeadLetterForwarder forwarder;
    private final byte[] body;
    private final Destination destination;
    private final Map<String, String> headers;

    private KafkaInboundMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
                                KafkaDeadLetterForwarder forwarder, String body, Destination destination) {
        this.record = record;
        this.acknowledgment = acknowledgment;
        this.forwarder = forwarder;
        this.body = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        this.destination = destination;
        this.headers = KafkaHeaders.toMap(record.headers());
        if (!headers.containsKey(RetryHeaders.FIRST_PUBLISHED_AT) && record.timestamp() > 0) {
            headers.put(RetryHeaders.FIRST_PUBLISHED_AT, String.valueOf(record.timestamp()));
        }
    }

    /**
     * @param forwarder null to drop rejected records instead of forwarding them
     */
    public static KafkaInboundMessage of(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
                                         KafkaDeadLetterForwarder forwarder) {
        return new KafkaInboundMessage(record, acknowledgment, forwarder, record.value(),
                new Destination(record.topic(), record.key()));
    }

    /**
     * Unwraps a record read from a DLQ topic so it can be replayed: the body and
     * destination are those of the original record.
     */
    public static KafkaInboundMessage fromDeadLetter(ConsumerRecord<String, String> record,
                                                     Acknowledgment acknowledgment,
                                                     KafkaDeadLetterForwarder forwarder) throws JsonProcessingException {
        DlqMessage envelope = forwarder.read(record.value());
        return new KafkaInboundMessage(record, acknowledgment, null, envelope.getOriginalValue(),
                new Destination(envelope.getOriginalTopic(), envelope.getOriginalKey()));
    }

    @Override
    public byte[] body() {
        return body;
    }

    @Override
    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public Destination destination() {
        return destination;
    }

    @Override
    public String messageId() {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }

    public ConsumerRecord<String, String> record() {
        return record;
    }

    @Override
    protected void doAck() {
        acknowledgment.acknowledge();
    }

    @Override
    protected void doNack(boolean requeue) {
        if (requeue) {
            acknowledgment.nack(Duration.ZERO);
            return;
        }
        if (forwarder == null) {
            log.warn("No DLQ forwarder configured, dropping rejected record {}", messageId());
            acknowledgment.acknowledge();
            return;
        }
        try {
            forwarder.forward(this);
        } catch (RuntimeException e) {
            log.error("Failed to forward record {} to DLQ, seeking back for redelivery: {}",
                    messageId(), e.getMessage(), e);
            acknowledgment.nack(Duration.ZERO);
            return;
        }
        acknowledgment.acknowledge();
    }
}
