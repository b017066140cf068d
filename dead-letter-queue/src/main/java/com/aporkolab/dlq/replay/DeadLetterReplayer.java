package com.aporkolab.dlq.replay;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.dlq.classify.NonRetryableRegistry;
import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.middleware.RetryListener;
import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.Destination;
import com.aporkolab.dlq.transport.InboundMessage;
import com.aporkolab.dlq.transport.MessagePublisher;

/**
 * Sends dead-lettered messages back to their original destination once the
 * underlying problem is fixed.
 *
 * Replayed messages start with a fresh retry budget: every {@code x-retry-*}
 * and {@code x-dlq-*} header is dropped and the count is reset to zero. The first
 * publish timestamp is dropped too, so the TTL counts from the replay.
 */
public class DeadLetterReplayer {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterReplayer.class);

    public static final int DEFAULT_MAX_REPLAY_RETRY_COUNT = 5;

    private final MessagePublisher publisher;
    private final NonRetryableRegistry registry;
    private final DlqConfig config;
    private final int maxReplayRetryCount;
    private final List<RetryListener> listeners;

    public DeadLetterReplayer(MessagePublisher publisher, NonRetryableRegistry registry, DlqConfig config) {
        this(publisher, registry, config, DEFAULT_MAX_REPLAY_RETRY_COUNT, List.of());
    }

    public DeadLetterReplayer(MessagePublisher publisher, NonRetryableRegistry registry, DlqConfig config,
                              int maxReplayRetryCount, List<? extends RetryListener> listeners) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.maxReplayRetryCount = maxReplayRetryCount;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * A message is worth replaying when its failure looked transient and it has
     * not already burned through many retries.
     */
    public boolean shouldReplay(Map<String, ?> headers) {
        RetryState state = RetryState.fromHeaders(headers);
        if (state.getCount() >= maxReplayRetryCount) {
            return false;
        }
        String errorType = state.getLastErrorType();
        if (errorType.isEmpty()) {
            return true;
        }
        return !registry.isNonRetryable(errorType)
                && !config.getNonRetryableExceptionNames().contains(errorType);
    }

    /**
     * Republishes a dead-lettered message to {@code target}.
     * The dead-letter copy is acked on success and requeued on failure.
     *
     * @return true if the message was republished
     */
    public boolean replay(InboundMessage deadLetter, Destination target) {
        Objects.requireNonNull(target, "target");
        Map<String, String> headers = cleanHeaders(deadLetter.headers());

        try {
            publisher.publish(deadLetter.body(), target, headers);
        } catch (RuntimeException e) {
            log.error("Failed to replay DLQ message to {}: {}", target, e.getMessage(), e);
            deadLetter.nack(true);
            notifyReplay(deadLetter, false);
            return false;
        }

        deadLetter.ack();
        log.info("DLQ message replayed to {}", target);
        notifyReplay(deadLetter, true);
        return true;
    }

    static Map<String, String> cleanHeaders(Map<String, String> original) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (original != null) {
            original.forEach((key, value) -> {
                if (!key.startsWith(RetryHeaders.RETRY_PREFIX)
                        && !key.startsWith(RetryHeaders.DLQ_PREFIX)
                        && !key.equals(RetryHeaders.FIRST_PUBLISHED_AT)) {
                    headers.put(key, value);
                }
            });
        }
        headers.put(RetryHeaders.RETRY_COUNT, "0");
        return headers;
    }

    private void notifyReplay(InboundMessage message, boolean success) {
        for (RetryListener listener : listeners) {
            try {
                listener.onReplay(message, success);
            } catch (RuntimeException e) {
                log.warn("Replay listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
