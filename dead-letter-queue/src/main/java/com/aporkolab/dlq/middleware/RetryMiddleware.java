package com.aporkolab.dlq.middleware;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.dlq.backoff.DelayCalculator;
import com.aporkolab.dlq.classify.ErrorClassifier;
import com.aporkolab.dlq.classify.NonRetryableRegistry;
import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.poison.PoisonMessageDetector;
import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.InboundMessage;
import com.aporkolab.dlq.transport.MessagePublisher;
import com.aporkolab.dlq.ttl.TtlChecker;

/**
 * Retry-or-dead-letter orchestration around handler invocation.
 *
 * On handler failure the decision chain runs in a fixed order, cheapest and most
 * final checks first:
 * <ol>
 *   <li>non-retryable exception (registry or config filter)</li>
 *   <li>retry count budget</li>
 *   <li>retry duration budget</li>
 *   <li>poison message detection</li>
 *   <li>message TTL</li>
 * </ol>
 * If every check passes, the message waits out the backoff delay, is republished
 * to its original destination with updated retry headers, and the original is acked.
 * Otherwise the original is rejected without requeue and the broker's dead-letter
 * route takes over.
 *
 * The handler's exception is always rethrown after the decision is applied.
 * Retry state travels in message headers; this class holds no per-message state.
 */
public class RetryMiddleware implements MessageMiddleware, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);
    private static final int LOG_ERROR_LENGTH = 200;

    private final MessagePublisher publisher;
    private final DlqConfig config;
    private final ErrorClassifier classifier;
    private final PoisonMessageDetector poisonDetector;
    private final RetryDelayer delayer;
    private final List<RetryListener> listeners;
    private final Clock clock;

    private RetryMiddleware(Builder builder) {
        this.publisher = builder.publisher;
        this.config = builder.config;
        this.classifier = builder.classifier;
        this.poisonDetector = builder.poisonDetector;
        this.delayer = builder.delayer;
        this.listeners = List.copyOf(builder.listeners);
        this.clock = builder.clock;
    }

    public static Builder builder(MessagePublisher publisher, DlqConfig config) {
        return new Builder(publisher, config);
    }

    @Override
    public <T> T handle(InboundMessage message, MessageHandler<T> next) throws Exception {
        if (!config.isEnabled()) {
            return next.handle(message);
        }

        RetryState state = RetryState.fromHeaders(message.headers());

        try (DeliveryLogContext ignored = DeliveryLogContext.open(message, state)) {
            T result;
            try {
                result = next.handle(message);
            } catch (Exception e) {
                handleFailure(message, e, state);
                throw e;
            }
            if (state.hasAttempts()) {
                log.info("Message succeeded after {} retries", state.getCount());
                notifyListeners(l -> l.onSuccess(message, state));
            }
            return result;
        }
    }

    /**
     * Runs the decision chain for a failed delivery without acting on it.
     * Note that the poison check records the failure.
     */
    public RetryDecision decide(InboundMessage message, Throwable error, RetryState state) {
        if (classifier.isNonRetryable(error) || !config.shouldRetryException(error)) {
            return RetryDecision.deadLetter(DlqReason.NON_RETRYABLE, error);
        }

        if (state.getCount() >= config.getMaxRetries()) {
            return RetryDecision.deadLetter(DlqReason.MAX_RETRIES_EXCEEDED, error);
        }

        Duration maxDuration = config.getMaxRetryDuration();
        if (maxDuration != null && state.hasAttempts()
                && state.elapsedSinceFirstAttempt(clock).compareTo(maxDuration) >= 0) {
            return RetryDecision.deadLetter(DlqReason.MAX_DURATION_EXCEEDED, error);
        }

        if (poisonDetector != null && isPoison(message, error)) {
            return RetryDecision.deadLetter(DlqReason.POISON_MESSAGE, error);
        }

        if (TtlChecker.isExpired(message.headers(), config.getMessageTtl(), clock)) {
            return RetryDecision.deadLetter(DlqReason.MESSAGE_EXPIRED, error);
        }

        long delayMs = DelayCalculator.calculateDelay(config, state.getCount());
        return RetryDecision.retry(delayMs, state.increment(delayMs, error, clock));
    }

    private void handleFailure(InboundMessage message, Exception error, RetryState state) {
        RetryDecision decision = safeDecide(message, error, state);
        if (decision == null) {
            return;
        }

        if (decision.isRetry()) {
            scheduleRetry(message, decision, error);
        } else {
            logDeadLetter(decision, error);
            routeToDlq(message, decision, error);
            notifyListeners(l -> l.onDeadLettered(message, decision, state, error));
        }
    }

    private RetryDecision safeDecide(InboundMessage message, Exception error, RetryState state) {
        try {
            return decide(message, error, state);
        } catch (RuntimeException bookkeeping) {
            // leave the message for redelivery rather than lose it
            log.error("Retry decision failed for {}, leaving message unsettled: {}",
                    message.destination(), bookkeeping.getMessage(), bookkeeping);
            return null;
        }
    }

    private boolean isPoison(InboundMessage message, Throwable error) {
        try {
            return poisonDetector.checkAndRecord(message.body(), error);
        } catch (RuntimeException e) {
            log.error("Poison detection failed, continuing without it: {}", e.getMessage(), e);
            return false;
        }
    }

    private void scheduleRetry(InboundMessage message, RetryDecision decision, Exception error) {
        RetryState next = decision.getNextState();
        log.info("Scheduling retry {}/{} in {} ms for {}: {}",
                next.getCount(), config.getMaxRetries(), decision.getDelayMs(),
                error.getClass().getSimpleName(), abbreviate(error.getMessage(), 100));

        if (!delayer.await(Duration.ofMillis(decision.getDelayMs()))) {
            log.warn("Retry {} for {} cancelled during backoff, message left for redelivery",
                    next.getCount(), message.destination());
            notifyListeners(l -> l.onRetryCancelled(message, decision));
            return;
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (message.headers() != null) {
            headers.putAll(message.headers());
        }
        headers.putAll(next.toHeaders());

        try {
            publisher.publish(message.body(), message.destination(), headers);
        } catch (Exception publishError) {
            log.error("Failed to republish message for retry to {}, rejecting without requeue: {}",
                    message.destination(), publishError.getMessage(), publishError);
            settle(message, () -> message.nack(false), "reject");
            notifyListeners(l -> l.onRepublishFailed(message, decision, publishError));
            return;
        }

        settle(message, message::ack, "ack");
        notifyListeners(l -> l.onRetryScheduled(message, decision, error));
    }

    private void routeToDlq(InboundMessage message, RetryDecision decision, Throwable error) {
        log.info("Routing message from {} to DLQ, reason: {}", message.destination(), decision.getReasonCode());

        if (config.isTrackFailures()) {
            stampHeaders(message, decision, error);
        }
        settle(message, () -> message.nack(false), "reject");
    }

    private void settle(InboundMessage message, Runnable disposition, String action) {
        try {
            disposition.run();
        } catch (RuntimeException e) {
            log.error("Failed to {} message from {}: {}", action, message.destination(), e.getMessage(), e);
        }
    }

    private void stampHeaders(InboundMessage message, RetryDecision decision, Throwable error) {
        Map<String, String> headers = message.headers();
        if (headers == null) {
            return;
        }
        try {
            headers.put(RetryHeaders.DLQ_REASON, decision.getReasonCode());
            headers.put(RetryHeaders.LAST_ERROR, abbreviate(error.getMessage(), RetryHeaders.MAX_ERROR_LENGTH));
            headers.put(RetryHeaders.LAST_ERROR_TYPE, error.getClass().getSimpleName());
        } catch (UnsupportedOperationException | IllegalStateException immutable) {
            log.debug("Headers of message from {} are immutable, reason not stamped", message.destination());
        }
    }

    private void logDeadLetter(RetryDecision decision, Throwable error) {
        String detail = abbreviate(error.getMessage(), LOG_ERROR_LENGTH);
        switch (decision.getReason()) {
            case NON_RETRYABLE -> log.warn("Non-retryable exception {}, routing to DLQ: {}",
                    error.getClass().getSimpleName(), detail);
            case MAX_RETRIES_EXCEEDED -> log.error("Max retries ({}) exceeded, routing to DLQ: {}",
                    config.getMaxRetries(), detail);
            case MAX_DURATION_EXCEEDED -> log.error("Max retry duration ({} ms) exceeded, routing to DLQ: {}",
                    config.getMaxRetryDuration().toMillis(), detail);
            case POISON_MESSAGE -> log.error("Poison message detected, routing to DLQ: {}", detail);
            case MESSAGE_EXPIRED -> log.warn("Message TTL expired, routing to DLQ: {}", detail);
        }
    }

    private void notifyListeners(Consumer<RetryListener> callback) {
        for (RetryListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Retry listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * Cancels pending retry waits if the delayer supports it.
     */
    @Override
    public void close() throws Exception {
        if (delayer instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    public DlqConfig getConfig() {
        return config;
    }

    public PoisonMessageDetector getPoisonDetector() {
        return poisonDetector;
    }

    public static class Builder {
        private final MessagePublisher publisher;
        private final DlqConfig config;
        private ErrorClassifier classifier = new NonRetryableRegistry();
        private PoisonMessageDetector poisonDetector;
        private RetryDelayer delayer = new InterruptibleRetryDelayer();
        private final List<RetryListener> listeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        private Builder(MessagePublisher publisher, DlqConfig config) {
            this.publisher = Objects.requireNonNull(publisher, "publisher");
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        /** Null disables poison detection. */
        public Builder poisonDetector(PoisonMessageDetector poisonDetector) {
            this.poisonDetector = poisonDetector;
            return this;
        }

        public Builder delayer(RetryDelayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer");
            return this;
        }

        public Builder listener(RetryListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder listeners(List<? extends RetryListener> listeners) {
            listeners.forEach(this::listener);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RetryMiddleware build() {
            return new RetryMiddleware(this);
        }
    }
}
