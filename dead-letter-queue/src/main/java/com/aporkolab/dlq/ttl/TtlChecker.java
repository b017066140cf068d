package com.aporkolab.dlq.ttl;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

import com.aporkolab.dlq.state.RetryHeaders;

/**
 * Message age check against a configured TTL.
 *
 * Messages without a readable publish timestamp are never expired.
 */
public final class TtlChecker {

    private TtlChecker() {
    }

    public static boolean isExpired(Map<String, ?> headers, Duration ttl) {
        return isExpired(headers, ttl, Clock.systemUTC());
    }

    public static boolean isExpired(Map<String, ?> headers, Duration ttl, Clock clock) {
        if (ttl == null) {
            return false;
        }
        return publishedAt(headers)
                .map(published -> published.plus(ttl).isBefore(clock.instant()))
                .orElse(false);
    }

    /**
     * Reads {@link RetryHeaders#FIRST_PUBLISHED_AT} as epoch millis or an ISO-8601 instant.
     */
    public static Optional<Instant> publishedAt(Map<String, ?> headers) {
        if (headers == null) {
            return Optional.empty();
        }
        Object value = headers.get(RetryHeaders.FIRST_PUBLISHED_AT);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return positive(number.longValue());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        String text = value instanceof byte[] bytes
                ? new String(bytes, StandardCharsets.UTF_8).trim()
                : value.toString().trim();
        try {
            return positive(Long.parseLong(text));
        } catch (NumberFormatException e) {
            try {
                return Optional.of(Instant.parse(text));
            } catch (DateTimeParseException unparsable) {
                return Optional.empty();
            }
        }
    }

    private static Optional<Instant> positive(long epochMillis) {
        return epochMillis > 0 ? Optional.of(Instant.ofEpochMilli(epochMillis)) : Optional.empty();
    }
}
