package com.aporkolab.dlq.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import com.aporkolab.dlq.middleware.RetryDecision;
import com.aporkolab.dlq.middleware.RetryListener;
import com.aporkolab.dlq.poison.PoisonMessageDetector;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.InboundMessage;

import java.time.Duration;

/**
 * Micrometer metrics for the retry engine, fed through {@link RetryListener} callbacks.
 *
 * Provides the following metrics:
 * - dlq_messages_total: Messages routed to the DLQ
 * - dlq_messages_by_reason_total: Messages routed to the DLQ by reason code
 * - dlq_retries_total: Retries scheduled
 * - dlq_retry_attempts: Retries scheduled by attempt number
 * - dlq_retry_delay: Backoff delays applied before republishing
 * - dlq_republish_failures_total: Retries that could not be republished
 * - dlq_retry_cancelled_total: Retry waits cut short by shutdown
 * - dlq_success_after_retry_total: Messages that succeeded after at least one retry
 * - dlq_replay_total / dlq_replay_success_total: Replays from the DLQ
 * - dlq_poison_tracked_entries: Keys currently tracked by the poison detector
 */
public class DlqMetrics implements RetryListener {

    private static final String METRIC_PREFIX = "dlq";

    private final MeterRegistry registry;
    private final Tags baseTags;

    private final Counter messagesCounter;
    private final Counter retriesCounter;
    private final Counter republishFailuresCounter;
    private final Counter retryCancelledCounter;
    private final Counter successAfterRetryCounter;
    private final Counter replayCounter;
    private final Counter replaySuccessCounter;
    private final Timer retryDelayTimer;

    public DlqMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public DlqMetrics(MeterRegistry registry, String dlqName) {
        this(registry, Tags.of("dlq_name", dlqName));
    }

    public DlqMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.messagesCounter = Counter.builder(METRIC_PREFIX + "_messages_total")
                .description("Total messages routed to the DLQ")
                .tags(baseTags)
                .register(registry);

        this.retriesCounter = Counter.builder(METRIC_PREFIX + "_retries_total")
                .description("Total retries scheduled")
                .tags(baseTags)
                .register(registry);

        this.republishFailuresCounter = Counter.builder(METRIC_PREFIX + "_republish_failures_total")
                .description("Retries rejected because republishing failed")
                .tags(baseTags)
                .register(registry);

        this.retryCancelledCounter = Counter.builder(METRIC_PREFIX + "_retry_cancelled_total")
                .description("Retry waits cancelled before republishing")
                .tags(baseTags)
                .register(registry);

        this.successAfterRetryCounter = Counter.builder(METRIC_PREFIX + "_success_after_retry_total")
                .description("Messages handled successfully after at least one retry")
                .tags(baseTags)
                .register(registry);

        this.replayCounter = Counter.builder(METRIC_PREFIX + "_replay_total")
                .description("Replay attempts from the DLQ")
                .tags(baseTags)
                .register(registry);

        this.replaySuccessCounter = Counter.builder(METRIC_PREFIX + "_replay_success_total")
                .description("Successful replays from the DLQ")
                .tags(baseTags)
                .register(registry);

        this.retryDelayTimer = Timer.builder(METRIC_PREFIX + "_retry_delay")
                .description("Backoff delay applied before a retry")
                .tags(baseTags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Exposes the number of keys the detector is tracking as a gauge.
     */
    public DlqMetrics bindPoisonDetector(PoisonMessageDetector detector) {
        Gauge.builder(METRIC_PREFIX + "_poison_tracked_entries", detector, PoisonMessageDetector::size)
                .description("Body/error keys tracked by the poison message detector")
                .tags(baseTags)
                .register(registry);
        return this;
    }

    @Override
    public void onSuccess(InboundMessage message, RetryState state) {
        successAfterRetryCounter.increment();
    }

    @Override
    public void onRetryScheduled(InboundMessage message, RetryDecision decision, Throwable error) {
        recordRetry(decision.getNextState().getCount(), Duration.ofMillis(decision.getDelayMs()));
    }

    @Override
    public void onDeadLettered(InboundMessage message, RetryDecision decision, RetryState state, Throwable error) {
        recordMessageSent(decision.getReasonCode());
    }

    @Override
    public void onRepublishFailed(InboundMessage message, RetryDecision decision, Exception publishError) {
        republishFailuresCounter.increment();
    }

    @Override
    public void onRetryCancelled(InboundMessage message, RetryDecision decision) {
        retryCancelledCounter.increment();
    }

    @Override
    public void onReplay(InboundMessage message, boolean success) {
        replayCounter.increment();
        if (success) {
            replaySuccessCounter.increment();
        }
    }

    /**
     * Record a message being routed to the DLQ.
     */
    public void recordMessageSent(String reasonCode) {
        messagesCounter.increment();

        Counter.builder(METRIC_PREFIX + "_messages_by_reason_total")
                .tags(baseTags.and("reason", reasonCode))
                .description("Messages routed to the DLQ by reason")
                .register(registry)
                .increment();
    }

    /**
     * Record a scheduled retry with its attempt number and delay.
     */
    public void recordRetry(int attemptNumber, Duration delay) {
        retriesCounter.increment();
        retryDelayTimer.record(delay);

        Counter.builder(METRIC_PREFIX + "_retry_attempts")
                .tags(baseTags.and("attempt", String.valueOf(attemptNumber)))
                .register(registry)
                .increment();
    }

    /**
     * Get replay success rate in percent.
     */
    public double getReplaySuccessRate() {
        double total = replayCounter.count();
        if (total == 0) return 0.0;
        return (replaySuccessCounter.count() / total) * 100.0;
    }

    public double getMessagesSent() {
        return messagesCounter.count();
    }

    public double getRetriesScheduled() {
        return retriesCounter.count();
    }
}
