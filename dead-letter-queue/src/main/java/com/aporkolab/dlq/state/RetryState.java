package com.aporkolab.dlq.state;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Retry history of a single message, carried in its headers across redeliveries.
 *
 * Immutable: {@link #increment} returns a new instance. A state with
 * {@code count == 0} has every other field at its default.
 *
 * Decoding never throws; absent or unparsable values fall back to zero/empty,
 * so freshly published messages and messages after N retries share one decoder.
 */
public final class RetryState {

    private static final RetryState INITIAL = new RetryState(0, 0L, 0L, "", "", 0L);

    private final int count;
    private final long firstAttemptMs;
    private final long totalDelayMs;
    private final String lastError;
    private final String lastErrorType;
    private final long lastAttemptMs;

    private RetryState(int count, long firstAttemptMs, long totalDelayMs,
                       String lastError, String lastErrorType, long lastAttemptMs) {
        this.count = count;
        this.firstAttemptMs = firstAttemptMs;
        this.totalDelayMs = totalDelayMs;
        this.lastError = lastError;
        this.lastErrorType = lastErrorType;
        this.lastAttemptMs = lastAttemptMs;
    }

    public static RetryState initial() {
        return INITIAL;
    }

    /**
     * Accepts String, byte[] (UTF-8) and Number header values.
     */
    public static RetryState fromHeaders(Map<String, ?> headers) {
        if (headers == null || headers.isEmpty()) {
            return INITIAL;
        }
        int count = (int) Math.min(Integer.MAX_VALUE, parseLong(headers.get(RetryHeaders.RETRY_COUNT)));
        if (count <= 0) {
            return INITIAL;
        }
        return new RetryState(
                count,
                parseLong(headers.get(RetryHeaders.FIRST_ATTEMPT_MS)),
                parseLong(headers.get(RetryHeaders.TOTAL_DELAY_MS)),
                truncate(asString(headers.get(RetryHeaders.LAST_ERROR))),
                asString(headers.get(RetryHeaders.LAST_ERROR_TYPE)),
                parseLong(headers.get(RetryHeaders.LAST_ATTEMPT_MS))
        );
    }

    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RetryHeaders.RETRY_COUNT, String.valueOf(count));
        headers.put(RetryHeaders.FIRST_ATTEMPT_MS, String.valueOf(firstAttemptMs));
        headers.put(RetryHeaders.TOTAL_DELAY_MS, String.valueOf(totalDelayMs));
        headers.put(RetryHeaders.LAST_ERROR, truncate(lastError));
        headers.put(RetryHeaders.LAST_ERROR_TYPE, lastErrorType);
        headers.put(RetryHeaders.LAST_ATTEMPT_MS, String.valueOf(lastAttemptMs));
        return headers;
    }

    public RetryState increment(long delayMs, Throwable error) {
        return increment(delayMs, error, Clock.systemUTC());
    }

    public RetryState increment(long delayMs, Throwable error, Clock clock) {
        long now = clock.millis();
        return new RetryState(
                count + 1,
                count == 0 || firstAttemptMs == 0 ? now : firstAttemptMs,
                totalDelayMs + Math.max(0L, delayMs),
                truncate(errorMessage(error)),
                error == null ? "" : error.getClass().getSimpleName(),
                now
        );
    }

    public Duration elapsedSinceFirstAttempt() {
        return elapsedSinceFirstAttempt(Clock.systemUTC());
    }

    public Duration elapsedSinceFirstAttempt(Clock clock) {
        if (count == 0 || firstAttemptMs == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.max(0L, clock.millis() - firstAttemptMs));
    }

    public boolean hasAttempts() {
        return count > 0;
    }

    public int getCount() {
        return count;
    }

    public long getFirstAttemptMs() {
        return firstAttemptMs;
    }

    public long getTotalDelayMs() {
        return totalDelayMs;
    }

    public String getLastError() {
        return lastError;
    }

    public String getLastErrorType() {
        return lastErrorType;
    }

    public long getLastAttemptMs() {
        return lastAttemptMs;
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= RetryHeaders.MAX_ERROR_LENGTH
                ? value
                : value.substring(0, RetryHeaders.MAX_ERROR_LENGTH);
    }

    private static String errorMessage(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return "";
        }
        return error.getMessage();
    }

    private static String asString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    private static long parseLong(Object value) {
        if (value instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        String text = asString(value).trim();
        if (text.isEmpty()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(text));
        } catch (NumberFormatException e) {
            try {
                // some producers write "3.0"
                return Math.max(0L, (long) Double.parseDouble(text));
            } catch (NumberFormatException ignored) {
                return 0L;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryState other)) return false;
        return count == other.count
                && firstAttemptMs == other.firstAttemptMs
                && totalDelayMs == other.totalDelayMs
                && lastAttemptMs == other.lastAttemptMs
                && lastError.equals(other.lastError)
                && lastErrorType.equals(other.lastErrorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, firstAttemptMs, totalDelayMs, lastError, lastErrorType, lastAttemptMs);
    }

    @Override
    public String toString() {
        return "RetryState{count=" + count
                + ", firstAttemptMs=" + firstAttemptMs
                + ", totalDelayMs=" + totalDelayMs
                + ", lastErrorType='" + lastErrorType + '\''
                + ", lastAttemptMs=" + lastAttemptMs + '}';
    }
}
