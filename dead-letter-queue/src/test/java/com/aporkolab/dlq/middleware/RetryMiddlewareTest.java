package com.aporkolab.dlq.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aporkolab.dlq.classify.NonRetryableRegistry;
import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.config.RetryPolicy;
import com.aporkolab.dlq.poison.PoisonMessageDetector;
import com.aporkolab.dlq.state.RetryHeaders;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.Destination;
import com.aporkolab.dlq.transport.MessagePublishException;
import com.aporkolab.dlq.transport.MessagePublisher;
import com.aporkolab.dlq.transport.TestInboundMessage;
import com.aporkolab.dlq.transport.TestInboundMessage.Disposition;

@ExtendWith(MockitoExtension.class)
class RetryMiddlewareTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MessagePublisher publisher;

    @Mock
    private RetryListener listener;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private RecordingDelayer delayer;
    private DlqConfig config;

    @BeforeEach
    void setUp() {
        delayer = new RecordingDelayer();
        config = DlqConfig.builder()
                .maxRetries(5)
                .retryPolicy(RetryPolicy.EXPONENTIAL)
                .initialDelay(Duration.ofSeconds(1))
                .jitterEnabled(false)
                .build();
    }

    private RetryMiddleware middleware(DlqConfig config) {
        return RetryMiddleware.builder(publisher, config)
                .delayer(delayer)
                .poisonDetector(new PoisonMessageDetector(3, 100))
                .listener(listener)
                .clock(clock)
                .build();
    }

    private static MessageHandler<String> failingWith(Exception error) {
        return message -> {
            throw error;
        };
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> capturePublishedHeaders() {
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(publisher).publish(any(byte[].class), eq(Destination.of("orders")), captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Transient failures")
    class TransientFailures {

        @Test
        @DisplayName("should republish a fresh message with retry count one and ack the original")
        void shouldRepublishFirstFailure() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":1}");
            TimeoutException error = new TimeoutException("inventory service timed out");

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(error)))
                    .isSameAs(error);

            Map<String, String> headers = capturePublishedHeaders();
            assertThat(headers)
                    .containsEntry(RetryHeaders.RETRY_COUNT, "1")
                    .containsEntry(RetryHeaders.TOTAL_DELAY_MS, "1000")
                    .containsEntry(RetryHeaders.LAST_ERROR, "inventory service timed out")
                    .containsEntry(RetryHeaders.LAST_ERROR_TYPE, "TimeoutException")
                    .containsEntry(RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.toEpochMilli()));
            assertThat(delayer.getWaits()).containsExactly(Duration.ofSeconds(1));
            assertThat(message.getDisposition()).isEqualTo(Disposition.ACK);
            verify(listener).onRetryScheduled(eq(message), any(RetryDecision.class), eq(error));
        }

        @Test
        @DisplayName("should back off exponentially from the carried retry count")
        void shouldBackOffFromHeaders() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":1}", Map.of(
                    RetryHeaders.RETRY_COUNT, "2",
                    RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.minusSeconds(3).toEpochMilli()),
                    RetryHeaders.TOTAL_DELAY_MS, "3000",
                    "traceparent", "00-abc-def-01"));

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            Map<String, String> headers = capturePublishedHeaders();
            assertThat(delayer.getWaits()).containsExactly(Duration.ofSeconds(4));
            assertThat(headers)
                    .containsEntry(RetryHeaders.RETRY_COUNT, "3")
                    .containsEntry(RetryHeaders.TOTAL_DELAY_MS, "7000")
                    .containsEntry(RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.minusSeconds(3).toEpochMilli()))
                    .containsEntry("traceparent", "00-abc-def-01");
        }

        @Test
        @DisplayName("should reject without requeue when republishing fails")
        void shouldRejectWhenRepublishFails() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":1}");
            MessagePublishException publishError =
                    new MessagePublishException(Destination.of("orders"), "broker down");
            doThrow(publishError).when(publisher).publish(any(), any(), anyMap());

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.getDisposition()).isEqualTo(Disposition.NACK_DROP);
            verify(listener).onRepublishFailed(eq(message), any(RetryDecision.class), eq(publishError));
            verify(listener, never()).onRetryScheduled(any(), any(), any());
        }

        @Test
        @DisplayName("should leave the message unsettled when the wait is cancelled")
        void shouldLeaveMessageOnCancel() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":1}");
            delayer.cancelAll();

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.isDisposed()).isFalse();
            verifyNoInteractions(publisher);
            verify(listener).onRetryCancelled(eq(message), any(RetryDecision.class));
        }
    }

    @Nested
    @DisplayName("Retry sequence")
    class RetrySequence {

        @Test
        @DisplayName("should retry twice with linear waits then dead-letter the third delivery")
        @SuppressWarnings("unchecked")
        void shouldRunLinearSequenceIntoDeadLetter() {
            DlqConfig linear = DlqConfig.builder()
                    .maxRetries(2)
                    .retryPolicy(RetryPolicy.LINEAR)
                    .initialDelay(Duration.ofSeconds(1))
                    .jitterEnabled(false)
                    .build();
            RetryMiddleware middleware = middleware(linear);
            TimeoutException error = new TimeoutException("payment gateway timed out");
            String body = "{\"orderId\":42}";
            ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);

            TestInboundMessage first = TestInboundMessage.of(body);
            assertThatThrownBy(() -> middleware.handle(first, failingWith(error))).isSameAs(error);
            verify(publisher, times(1)).publish(any(byte[].class), eq(Destination.of("orders")), captor.capture());
            Map<String, String> afterFirst = captor.getValue();
            assertThat(afterFirst)
                    .containsEntry(RetryHeaders.RETRY_COUNT, "1")
                    .containsEntry(RetryHeaders.TOTAL_DELAY_MS, "1000");
            assertThat(first.getDisposition()).isEqualTo(Disposition.ACK);

            TestInboundMessage second = TestInboundMessage.of(body, afterFirst);
            assertThatThrownBy(() -> middleware.handle(second, failingWith(error))).isSameAs(error);
            verify(publisher, times(2)).publish(any(byte[].class), eq(Destination.of("orders")), captor.capture());
            Map<String, String> afterSecond = captor.getValue();
            assertThat(afterSecond)
                    .containsEntry(RetryHeaders.RETRY_COUNT, "2")
                    .containsEntry(RetryHeaders.TOTAL_DELAY_MS, "3000")
                    .containsEntry(RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.toEpochMilli()));
            assertThat(second.getDisposition()).isEqualTo(Disposition.ACK);

            TestInboundMessage third = TestInboundMessage.of(body, afterSecond);
            assertThatThrownBy(() -> middleware.handle(third, failingWith(error))).isSameAs(error);

            verify(publisher, times(2)).publish(any(byte[].class), any(Destination.class), anyMap());
            assertThat(delayer.getWaits()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
            assertThat(third.getDisposition()).isEqualTo(Disposition.NACK_DROP);
            assertThat(third.headers()).containsEntry(RetryHeaders.DLQ_REASON, "max_retries_exceeded");
            verify(listener).onDeadLettered(eq(third), any(RetryDecision.class), any(RetryState.class), eq(error));
        }
    }

    @Nested
    @DisplayName("Dead-letter routing")
    class DeadLetterRouting {

        @Test
        @DisplayName("should dead-letter once the retry budget is used up")
        void shouldDeadLetterAfterMaxRetries() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":1}", Map.of(
                    RetryHeaders.RETRY_COUNT, "5",
                    RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.minusSeconds(31).toEpochMilli())));
            TimeoutException error = new TimeoutException("still down");

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(error)))
                    .isSameAs(error);

            verifyNoInteractions(publisher);
            assertThat(delayer.getWaits()).isEmpty();
            assertThat(message.getDisposition()).isEqualTo(Disposition.NACK_DROP);
            assertThat(message.headers()).containsEntry(RetryHeaders.DLQ_REASON, "max_retries_exceeded");
            ArgumentCaptor<RetryDecision> decision = ArgumentCaptor.forClass(RetryDecision.class);
            verify(listener).onDeadLettered(eq(message), decision.capture(), any(RetryState.class), eq(error));
            assertThat(decision.getValue().getReason()).isEqualTo(DlqReason.MAX_RETRIES_EXCEEDED);
        }

        @Test
        @DisplayName("should dead-letter non-retryable errors without retrying")
        void shouldDeadLetterNonRetryable() {
            TestInboundMessage message = TestInboundMessage.of("{\"orderId\":\"abc\"}");

            assertThatThrownBy(() -> middleware(config)
                    .handle(message, failingWith(new IllegalArgumentException("orderId must be numeric"))))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(publisher);
            assertThat(message.getDisposition()).isEqualTo(Disposition.NACK_DROP);
            assertThat(message.headers())
                    .containsEntry(RetryHeaders.DLQ_REASON, "non_retryable:IllegalArgumentException")
                    .containsEntry(RetryHeaders.LAST_ERROR_TYPE, "IllegalArgumentException");
        }

        @Test
        @DisplayName("should honour a custom registry entry")
        void shouldHonourCustomRegistry() {
            NonRetryableRegistry registry = new NonRetryableRegistry();
            registry.register("IllegalStateException");
            RetryMiddleware middleware = RetryMiddleware.builder(publisher, config)
                    .classifier(registry)
                    .delayer(delayer)
                    .build();
            TestInboundMessage message = TestInboundMessage.of("x");

            assertThatThrownBy(() -> middleware.handle(message, failingWith(new IllegalStateException())))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(message.headers()).containsEntry(RetryHeaders.DLQ_REASON, "non_retryable:IllegalStateException");
        }

        @Test
        @DisplayName("should dead-letter once the retry duration is exceeded")
        void shouldDeadLetterAfterMaxDuration() {
            DlqConfig bounded = DlqConfig.builder()
                    .jitterEnabled(false)
                    .maxRetryDuration(Duration.ofMinutes(1))
                    .build();
            TestInboundMessage message = TestInboundMessage.of("x", Map.of(
                    RetryHeaders.RETRY_COUNT, "1",
                    RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(NOW.minus(Duration.ofMinutes(2)).toEpochMilli())));

            assertThatThrownBy(() -> middleware(bounded).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.headers()).containsEntry(RetryHeaders.DLQ_REASON, "max_duration_exceeded");
        }

        @Test
        @DisplayName("should dead-letter a message that keeps failing the same way")
        void shouldDeadLetterPoison() throws Exception {
            RetryMiddleware middleware = middleware(config);
            IllegalStateException error = new IllegalStateException("parser crashed");

            for (int i = 0; i < 2; i++) {
                TestInboundMessage delivery = TestInboundMessage.of("{\"broken\":");
                assertThatThrownBy(() -> middleware.handle(delivery, failingWith(error)));
                assertThat(delivery.getDisposition()).isEqualTo(Disposition.ACK);
            }
            TestInboundMessage third = TestInboundMessage.of("{\"broken\":");
            assertThatThrownBy(() -> middleware.handle(third, failingWith(error)));

            assertThat(third.getDisposition()).isEqualTo(Disposition.NACK_DROP);
            assertThat(third.headers()).containsEntry(RetryHeaders.DLQ_REASON, "poison_message");
        }

        @Test
        @DisplayName("should dead-letter expired messages")
        void shouldDeadLetterExpired() {
            TestInboundMessage message = TestInboundMessage.of("x", Map.of(
                    RetryHeaders.FIRST_PUBLISHED_AT, String.valueOf(NOW.minus(Duration.ofDays(2)).toEpochMilli())));

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.headers()).containsEntry(RetryHeaders.DLQ_REASON, "message_expired");
        }

        @Test
        @DisplayName("should check non-retryable before the retry budget")
        void shouldApplyChecksInOrder() {
            TestInboundMessage message = TestInboundMessage.of("x", Map.of(RetryHeaders.RETRY_COUNT, "9"));

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new IllegalArgumentException())))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(message.headers()).containsEntry(RetryHeaders.DLQ_REASON, "non_retryable:IllegalArgumentException");
        }

        @Test
        @DisplayName("should still reject when headers are immutable")
        void shouldRejectWithImmutableHeaders() {
            TestInboundMessage message = new TestInboundMessage("x", Map.of(RetryHeaders.RETRY_COUNT, "5"),
                    Destination.of("orders"));

            assertThatThrownBy(() -> middleware(config).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.getDisposition()).isEqualTo(Disposition.NACK_DROP);
        }

        @Test
        @DisplayName("should not stamp headers when failure tracking is off")
        void shouldNotStampWhenTrackingDisabled() {
            DlqConfig untracked = DlqConfig.builder().trackFailures(false).build();
            TestInboundMessage message = TestInboundMessage.of("x");

            assertThatThrownBy(() -> middleware(untracked).handle(message, failingWith(new IllegalArgumentException())))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(message.headers()).doesNotContainKey(RetryHeaders.DLQ_REASON);
            assertThat(message.getDisposition()).isEqualTo(Disposition.NACK_DROP);
        }
    }

    @Nested
    @DisplayName("Success and pass-through")
    class Success {

        @Test
        @DisplayName("should return the handler result without settling")
        void shouldReturnResult() throws Exception {
            TestInboundMessage message = TestInboundMessage.of("x");

            String result = middleware(config).handle(message, m -> "handled");

            assertThat(result).isEqualTo("handled");
            assertThat(message.isDisposed()).isFalse();
            verify(listener, never()).onSuccess(any(), any());
        }

        @Test
        @DisplayName("should report success after retries")
        void shouldReportSuccessAfterRetries() throws Exception {
            TestInboundMessage message = TestInboundMessage.of("x", Map.of(RetryHeaders.RETRY_COUNT, "2"));

            middleware(config).handle(message, m -> "handled");

            ArgumentCaptor<RetryState> state = ArgumentCaptor.forClass(RetryState.class);
            verify(listener).onSuccess(eq(message), state.capture());
            assertThat(state.getValue().getCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should pass through untouched when disabled")
        void shouldPassThroughWhenDisabled() {
            TestInboundMessage message = TestInboundMessage.of("x");
            DlqConfig disabled = DlqConfig.builder().enabled(false).build();

            assertThatThrownBy(() -> middleware(disabled).handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.isDisposed()).isFalse();
            verifyNoInteractions(publisher, listener);
        }

        @Test
        @DisplayName("should isolate listener failures")
        void shouldIsolateListenerFailures() {
            TestInboundMessage message = TestInboundMessage.of("x");
            RetryListener broken = mock(RetryListener.class);
            doThrow(new IllegalStateException("metrics down"))
                    .when(broken).onRetryScheduled(any(), any(), any());
            RetryMiddleware middleware = RetryMiddleware.builder(publisher, config)
                    .delayer(delayer)
                    .listener(broken)
                    .listener(listener)
                    .build();

            assertThatThrownBy(() -> middleware.handle(message, failingWith(new TimeoutException())))
                    .isInstanceOf(TimeoutException.class);

            assertThat(message.getDisposition()).isEqualTo(Disposition.ACK);
            verify(listener).onRetryScheduled(eq(message), any(), any());
        }
    }

    @Test
    @DisplayName("decide should produce a retry decision with the next state")
    void decideShouldProduceRetry() {
        RetryDecision decision = middleware(config)
                .decide(TestInboundMessage.of("x"), new TimeoutException("t"), RetryState.initial());

        assertThat(decision.isRetry()).isTrue();
        assertThat(decision.getDelayMs()).isEqualTo(1000);
        assertThat(decision.getNextState().getCount()).isEqualTo(1);
    }
}
