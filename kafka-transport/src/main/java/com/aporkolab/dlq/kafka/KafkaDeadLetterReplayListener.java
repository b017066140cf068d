package com.aporkolab.dlq.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;

import com.aporkolab.dlq.replay.DeadLetterReplayer;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Drains a DLQ topic back into the original topics.
 *
 * Records that should not be replayed (permanent failures, exhausted budgets)
 * and records that are not DLQ envelopes are committed and left behind in the DLQ topic.
 * Start a container with this listener only while replaying, e.g. after a fix is deployed.
 */
public class KafkaDeadLetterReplayListener implements AcknowledgingMessageListener<String, String> {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterReplayListener.class);

    private final DeadLetterReplayer replayer;
    private final KafkaDeadLetterForwarder forwarder;

    public KafkaDeadLetterReplayListener(DeadLetterReplayer replayer, KafkaDeadLetterForwarder forwarder) {
        this.replayer = replayer;
        this.forwarder = forwarder;
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        KafkaInboundMessage deadLetter;
        try {
            deadLetter = KafkaInboundMessage.fromDeadLetter(record, acknowledgment, forwarder);
        } catch (JsonProcessingException e) {
            log.error("Skipping unreadable DLQ record {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getOriginalMessage());
            acknowledgment.acknowledge();
            return;
        }

        if (!replayer.shouldReplay(deadLetter.headers())) {
            log.info("Not replaying {}: permanent failure or retry budget exhausted", deadLetter.messageId());
            deadLetter.ack();
            return;
        }
        replayer.replay(deadLetter, deadLetter.destination());
    }
}
