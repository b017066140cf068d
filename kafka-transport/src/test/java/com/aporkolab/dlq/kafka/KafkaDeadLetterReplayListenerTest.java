package com.aporkolab.dlq.kafka;

import static com.aporkolab.dlq.kafka.KafkaTestRecords.createRecord;
import static com.aporkolab.dlq.kafka.KafkaTestRecords.header;
import static com.aporkolab.dlq.kafka.KafkaTestRecords.mockKafkaSend;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.aporkolab.dlq.classify.NonRetryableRegistry;
import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.replay.DeadLetterReplayer;
import com.aporkolab.dlq.state.RetryHeaders;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class KafkaDeadLetterReplayListenerTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private Acknowledgment acknowledgment;

    private ObjectMapper objectMapper;
    private KafkaDeadLetterReplayListener listener;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        KafkaMessagePublisher publisher = new KafkaMessagePublisher(kafkaTemplate, Duration.ofSeconds(1));
        KafkaDeadLetterForwarder forwarder = new KafkaDeadLetterForwarder(publisher, objectMapper,
                KafkaDeadLetterForwarder.DEFAULT_DLQ_SUFFIX, Clock.systemUTC());
        DeadLetterReplayer replayer = new DeadLetterReplayer(publisher, new NonRetryableRegistry(), DlqConfig.defaults());
        listener = new KafkaDeadLetterReplayListener(replayer, forwarder);
    }

    @Test
    @DisplayName("should replay transient failures to the original topic and key")
    @SuppressWarnings("unchecked")
    void shouldReplayTransientFailure() throws Exception {
        mockKafkaSend(kafkaTemplate);
        String envelope = envelope("IllegalStateException");

        listener.onMessage(createRecord("orders.dlq", "order-1", envelope, 0L, Map.of(
                RetryHeaders.RETRY_COUNT, "2",
                RetryHeaders.LAST_ERROR_TYPE, "IllegalStateException",
                RetryHeaders.DLQ_REASON, "max_retries_exceeded",
                "traceparent", "00-abc-01")), acknowledgment);

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> replayed = captor.getValue();
        assertThat(replayed.topic()).isEqualTo("orders");
        assertThat(replayed.key()).isEqualTo("order-1");
        assertThat(replayed.value()).isEqualTo("{\"orderId\":1}");
        assertThat(header(replayed, RetryHeaders.RETRY_COUNT)).isEqualTo("0");
        assertThat(header(replayed, RetryHeaders.DLQ_REASON)).isNull();
        assertThat(header(replayed, RetryHeaders.LAST_ERROR_TYPE)).isNull();
        assertThat(header(replayed, "traceparent")).isEqualTo("00-abc-01");
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("should leave permanent failures in the DLQ topic")
    void shouldSkipPermanentFailure() throws Exception {
        listener.onMessage(createRecord("orders.dlq", "order-1", envelope("IllegalArgumentException"), 0L, Map.of(
                RetryHeaders.RETRY_COUNT, "0",
                RetryHeaders.LAST_ERROR_TYPE, "IllegalArgumentException")), acknowledgment);

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("should commit and skip records that are not DLQ envelopes")
    void shouldSkipUnreadableRecord() {
        listener.onMessage(createRecord("orders.dlq", "order-1", "not json"), acknowledgment);

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        verify(acknowledgment).acknowledge();
    }

    private String envelope(String errorType) throws Exception {
        return objectMapper.writeValueAsString(DlqMessage.builder()
                .originalTopic("orders")
                .originalKey("order-1")
                .originalValue("{\"orderId\":1}")
                .reason("max_retries_exceeded")
                .errorType(errorType)
                .build());
    }
}
