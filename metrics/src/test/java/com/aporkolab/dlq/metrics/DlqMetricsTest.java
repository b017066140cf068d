package com.aporkolab.dlq.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.dlq.middleware.DlqReason;
import com.aporkolab.dlq.middleware.RetryDecision;
import com.aporkolab.dlq.poison.PoisonMessageDetector;
import com.aporkolab.dlq.state.RetryState;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class DlqMetricsTest {

    private MeterRegistry registry;
    private DlqMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DlqMetrics(registry, "orders");
    }

    @Nested
    @DisplayName("Dead-letter routing")
    class DeadLetters {

        @Test
        @DisplayName("should count dead letters in total and by reason")
        void shouldCountByReason() {
            metrics.onDeadLettered(null, RetryDecision.deadLetter(DlqReason.MAX_RETRIES_EXCEEDED, null),
                    RetryState.initial(), null);
            metrics.onDeadLettered(null, RetryDecision.deadLetter(DlqReason.NON_RETRYABLE,
                    new IllegalArgumentException()), RetryState.initial(), null);

            assertThat(registry.get("dlq_messages_total").tag("dlq_name", "orders").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("dlq_messages_by_reason_total")
                    .tag("reason", "non_retryable:IllegalArgumentException").counter().count())
                    .isEqualTo(1.0);
            assertThat(metrics.getMessagesSent()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("should record retries by attempt with their delay")
        void shouldRecordRetries() {
            RetryState next = RetryState.initial().increment(2000, new TimeoutException());

            metrics.onRetryScheduled(null, RetryDecision.retry(2000, next), new TimeoutException());

            assertThat(metrics.getRetriesScheduled()).isEqualTo(1.0);
            assertThat(registry.get("dlq_retry_attempts").tag("attempt", "1").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("dlq_retry_delay").timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(2000.0);
        }

        @Test
        @DisplayName("should count republish failures, cancellations and late successes")
        void shouldCountOutcomes() {
            metrics.onRepublishFailed(null, null, new IllegalStateException());
            metrics.onRetryCancelled(null, null);
            metrics.onSuccess(null, RetryState.initial());

            assertThat(registry.get("dlq_republish_failures_total").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("dlq_retry_cancelled_total").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("dlq_success_after_retry_total").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should record delays directly")
        void shouldRecordDirectly() {
            metrics.recordRetry(3, Duration.ofSeconds(4));

            assertThat(registry.get("dlq_retry_attempts").tag("attempt", "3").counter().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("should compute replay success rate")
    void shouldComputeReplayRate() {
        assertThat(metrics.getReplaySuccessRate()).isZero();

        metrics.onReplay(null, true);
        metrics.onReplay(null, false);

        assertThat(registry.get("dlq_replay_total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("dlq_replay_success_total").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getReplaySuccessRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should expose poison detector size as a gauge")
    void shouldExposePoisonGauge() {
        PoisonMessageDetector detector = new PoisonMessageDetector();
        metrics.bindPoisonDetector(detector);

        detector.checkAndRecord("a", new RuntimeException());
        detector.checkAndRecord("b", new RuntimeException());

        assertThat(registry.get("dlq_poison_tracked_entries").gauge().value()).isEqualTo(2.0);
    }
}
