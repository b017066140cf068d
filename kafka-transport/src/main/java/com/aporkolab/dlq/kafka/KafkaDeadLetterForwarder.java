package com.aporkolab.dlq.kafka;

import java.time.Clock;
import java.time.Instant;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.Destination;
import com.aporkolab.dlq.transport.MessagePublishException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Kafka has no broker-side dead-letter routing, so a rejected record is
 * forwarded to {@code <topic>.dlq} by the consumer.
 *
 * Design decisions:
 * - The DLQ record carries a {@link DlqMessage} envelope with full context for debugging
 * - Original headers are preserved, including the retry headers and {@code x-dlq-reason}
 * - The original key is kept so per-key ordering survives in the DLQ topic
 */
public class KafkaDeadLetterForwarder {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterForwarder.class);
    public static final String DEFAULT_DLQ_SUFFIX = ".dlq";

    private final KafkaMessagePublisher publisher;
    private final ObjectMapper objectMapper;
    private final String dlqSuffix;
    private final String hostname;
    private final Clock clock;

    public KafkaDeadLetterForwarder(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this(new KafkaMessagePublisher(kafkaTemplate), objectMapper, DEFAULT_DLQ_SUFFIX, Clock.systemUTC());
    }

    public KafkaDeadLetterForwarder(KafkaMessagePublisher publisher, ObjectMapper objectMapper,
                                    String dlqSuffix, Clock clock) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.dlqSuffix = dlqSuffix;
        this.clock = clock;
        this.hostname = System.getenv().getOrDefault("HOSTNAME", "unknown");
    }

    public String dlqTopicFor(String topic) {
        return topic + dlqSuffix;
    }

    /**
     * Sends the dead-letter copy of {@code message}. Throws {@link MessagePublishException}
     * if the copy could not be written.
     */
    public void forward(KafkaInboundMessage message) {
        ConsumerRecord<String, String> record = message.record();
        String dlqTopic = dlqTopicFor(record.topic());
        RetryState state = RetryState.fromHeaders(message.headers());

        DlqMessage dlqMessage = DlqMessage.builder()
                .originalTopic(record.topic())
                .originalPartition(record.partition())
                .originalOffset(record.offset())
                .originalKey(record.key())
                .originalValue(record.value())
                .originalTimestamp(record.timestamp() > 0 ? Instant.ofEpochMilli(record.timestamp()) : null)
                .reason(message.headers().get(RetryHeaders.DLQ_REASON))
                .errorType(message.headers().get(RetryHeaders.LAST_ERROR_TYPE))
                .errorMessage(message.headers().get(RetryHeaders.LAST_ERROR))
                .retryCount(state.getCount())
                .failedAt(clock.instant())
                .hostname(hostname)
                .build();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(dlqMessage);
        } catch (JsonProcessingException e) {
            throw new MessagePublishException(Destination.of(dlqTopic),
                    "Failed to serialize DLQ message for topic " + record.topic(), e);
        }

        ProducerRecord<String, String> dlqRecord = new ProducerRecord<>(dlqTopic, record.key(), payload);
        KafkaHeaders.copyInto(message.headers(), dlqRecord.headers());

        publisher.send(dlqRecord, new Destination(dlqTopic, record.key()));
        log.info("Message from {}-{}@{} sent to DLQ topic {}, reason: {}",
                record.topic(), record.partition(), record.offset(), dlqTopic, dlqMessage.getReason());
    }

    /**
     * Reads a DLQ envelope back.
     */
    public DlqMessage read(String payload) throws JsonProcessingException {
        return objectMapper.readValue(payload, DlqMessage.class);
    }
}
