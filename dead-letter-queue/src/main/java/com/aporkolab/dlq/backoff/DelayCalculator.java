package com.aporkolab.dlq.backoff;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import com.aporkolab.dlq.config.DlqConfig;

/**
 * Computes the wait before the next retry attempt.
 *
 * Stateless and side-effect free. The base delay is capped at {@code maxDelay}
 * before jitter is applied, so with jitter the result stays within
 * {@code maxDelay * jitterMax}.
 */
public final class DelayCalculator {

    private static final double SQRT_5 = Math.sqrt(5);
    private static final double PHI = (1 + SQRT_5) / 2;
    private static final double PSI = (1 - SQRT_5) / 2;

    private DelayCalculator() {
    }

    /**
     * @param attempt number of retries already made (0 before the first retry)
     * @return delay in milliseconds, never negative
     */
    public static long calculateDelay(DlqConfig config, int attempt) {
        return calculateDelay(config, attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Same as {@link #calculateDelay(DlqConfig, int)} with an explicit source of
     * uniform values in [0, 1) for the jitter factor.
     */
    public static long calculateDelay(DlqConfig config, int attempt, DoubleSupplier uniform) {
        int n = Math.max(attempt, 0);
        double initial = config.getInitialDelay().toMillis();
        double max = config.getMaxDelay().toMillis();

        double base = switch (config.getRetryPolicy()) {
            case IMMEDIATE -> 0;
            case LINEAR -> initial * (n + 1.0);
            case EXPONENTIAL -> initial * Math.pow(config.getRetryMultiplier(), n);
            case FIBONACCI -> initial * fibonacci(n + 1L);
        };

        // overflow to infinity or NaN clamps to the cap
        if (!Double.isFinite(base) || base > max) {
            base = max;
        }

        double delay = base;
        if (config.isJitterEnabled() && base > 0) {
            double min = config.getJitterMin();
            double range = config.getJitterMax() - min;
            delay = base * (min + uniform.getAsDouble() * range);
        }

        return Math.max(0L, Math.round(delay));
    }

    /**
     * n-th Fibonacci number via Binet's formula, fib(1) = fib(2) = 1.
     * Exact for every n the retry limit allows; saturates at {@link Long#MAX_VALUE}.
     */
    public static long fibonacci(long n) {
        if (n <= 0) {
            return 0;
        }
        return Math.round((Math.pow(PHI, n) - Math.pow(PSI, n)) / SQRT_5);
    }
}
