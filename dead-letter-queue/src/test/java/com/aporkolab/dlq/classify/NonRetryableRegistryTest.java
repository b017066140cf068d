package com.aporkolab.dlq.classify;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NonRetryableRegistryTest {

    private NonRetryableRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NonRetryableRegistry();
    }

    static class PaymentDeclinedException extends RuntimeException {
        PaymentDeclinedException(String message) {
            super(message);
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should classify data errors as non-retryable")
        void shouldClassifyDataErrors() {
            assertThat(registry.isNonRetryable(new IllegalArgumentException("bad"))).isTrue();
            assertThat(registry.isNonRetryable(new ClassCastException())).isTrue();
            assertThat(registry.classify(new NumberFormatException())).isEqualTo(ErrorClass.NON_RETRYABLE);
        }

        @Test
        @DisplayName("should classify transient errors as retryable")
        void shouldClassifyTransientErrors() {
            assertThat(registry.isNonRetryable(new TimeoutException())).isFalse();
            assertThat(registry.classify(new IllegalStateException())).isEqualTo(ErrorClass.RETRYABLE);
        }

        @Test
        @DisplayName("should always treat the marker exception as non-retryable")
        void shouldHonourMarker() {
            assertThat(registry.isNonRetryable(new NonRetryableMessageException("unknown tenant"))).isTrue();
        }

        @Test
        @DisplayName("should treat null as retryable")
        void shouldTreatNullAsRetryable() {
            assertThat(registry.isNonRetryable((Throwable) null)).isFalse();
        }

        @Test
        @DisplayName("should not allow removing defaults")
        void shouldKeepDefaults() {
            registry.unregister("IllegalArgumentException");

            assertThat(registry.isNonRetryable(new IllegalArgumentException())).isTrue();
            assertThat(registry.getDefaults()).contains("IllegalArgumentException");
        }
    }

    @Nested
    @DisplayName("Custom entries")
    class Custom {

        @Test
        @DisplayName("should register by simple name")
        void shouldRegisterBySimpleName() {
            registry.register("PaymentDeclinedException");

            assertThat(registry.isNonRetryable(new PaymentDeclinedException("card expired"))).isTrue();
            assertThat(registry.getCustom()).containsExactly("PaymentDeclinedException");
        }

        @Test
        @DisplayName("should register by class")
        void shouldRegisterByClass() {
            registry.register(PaymentDeclinedException.class);

            assertThat(registry.isNonRetryable(new PaymentDeclinedException("card expired"))).isTrue();
            assertThat(registry.getCustom()).containsExactly(PaymentDeclinedException.class.getName());
        }

        @Test
        @DisplayName("should unregister custom entries")
        void shouldUnregister() {
            registry.register(PaymentDeclinedException.class);
            registry.unregister(PaymentDeclinedException.class);

            assertThat(registry.isNonRetryable(new PaymentDeclinedException("x"))).isFalse();
            assertThat(registry.getCustom()).isEmpty();
        }

        @Test
        @DisplayName("should accept a custom default set")
        void shouldAcceptCustomDefaults() {
            NonRetryableRegistry narrow = new NonRetryableRegistry(List.of("TimeoutException"));

            assertThat(narrow.isNonRetryable(new TimeoutException())).isTrue();
            assertThat(narrow.isNonRetryable(new IllegalArgumentException())).isFalse();
        }

        @Test
        @DisplayName("should tolerate concurrent registration and lookup")
        void shouldTolerateConcurrency() throws InterruptedException {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(400);
            for (int i = 0; i < 400; i++) {
                int n = i;
                executor.submit(() -> {
                    try {
                        registry.register("Custom" + (n % 50) + "Exception");
                        registry.isNonRetryable(new IllegalStateException());
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(registry.getCustom()).hasSize(50);
        }
    }
}
