package com.aporkolab.dlq.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Retry and dead-letter behaviour for a consumer.
 *
 * Built once at startup, immutable afterwards and shared read-only by every
 * in-flight delivery, so it needs no synchronization.
 *
 * Usage:
 * <pre>
 * DlqConfig config = DlqConfig.builder()
 *         .maxRetries(5)
 *         .retryPolicy(RetryPolicy.EXPONENTIAL)
 *         .initialDelay(Duration.ofSeconds(1))
 *         .maxDelay(Duration.ofMinutes(1))
 *         .maxRetryDuration(Duration.ofMinutes(30))
 *         .build();
 * </pre>
 */
public final class DlqConfig {

    public static final int MAX_RETRIES_LIMIT = 20;

    public static final Set<String> DEFAULT_NON_RETRYABLE_EXCEPTIONS = Set.of(
            "IllegalArgumentException",
            "NumberFormatException",
            "ClassCastException",
            "NoSuchElementException",
            "JsonProcessingException",
            "JsonParseException",
            "ValidationException",
            "ConstraintViolationException"
    );

    private final boolean enabled;
    private final int maxRetries;
    private final Duration maxRetryDuration;
    private final RetryPolicy retryPolicy;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double retryMultiplier;
    private final boolean jitterEnabled;
    private final double jitterMin;
    private final double jitterMax;
    private final Duration messageTtl;
    private final Set<String> nonRetryableExceptionNames;
    private final Set<String> retryableExceptionNames;
    private final boolean trackFailures;

    private DlqConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxRetries = builder.maxRetries;
        this.maxRetryDuration = builder.maxRetryDuration;
        this.retryPolicy = builder.retryPolicy;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.retryMultiplier = builder.retryMultiplier;
        this.jitterEnabled = builder.jitterEnabled;
        this.jitterMin = builder.jitterMin;
        this.jitterMax = builder.jitterMax;
        this.messageTtl = builder.messageTtl;
        this.nonRetryableExceptionNames = Set.copyOf(builder.nonRetryableExceptionNames);
        this.retryableExceptionNames = builder.retryableExceptionNames == null
                ? null
                : Set.copyOf(builder.retryableExceptionNames);
        this.trackFailures = builder.trackFailures;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults only: exponential backoff from 1s capped at 60s, five retries, jitter on.
     */
    public static DlqConfig defaults() {
        return builder().build();
    }

    /**
     * Config-level exception filter.
     * A name in the non-retryable set always wins; when a retryable whitelist
     * is configured, only names on it are retried.
     */
    public boolean shouldRetryException(Throwable exception) {
        if (exception == null) {
            return true;
        }
        String simpleName = exception.getClass().getSimpleName();
        String qualifiedName = exception.getClass().getName();

        if (nonRetryableExceptionNames.contains(simpleName)
                || nonRetryableExceptionNames.contains(qualifiedName)) {
            return false;
        }
        if (retryableExceptionNames != null) {
            return retryableExceptionNames.contains(simpleName)
                    || retryableExceptionNames.contains(qualifiedName);
        }
        return true;
    }

    /**
     * Flat view of every setting, for startup logging.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("enabled", enabled);
        map.put("maxRetries", maxRetries);
        map.put("maxRetryDurationMs", maxRetryDuration == null ? null : maxRetryDuration.toMillis());
        map.put("retryPolicy", retryPolicy.name());
        map.put("initialDelayMs", initialDelay.toMillis());
        map.put("maxDelayMs", maxDelay.toMillis());
        map.put("retryMultiplier", retryMultiplier);
        map.put("jitterEnabled", jitterEnabled);
        map.put("jitterRange", List.of(jitterMin, jitterMax));
        map.put("messageTtlMs", messageTtl == null ? null : messageTtl.toMillis());
        map.put("nonRetryableExceptions", nonRetryableExceptionNames);
        map.put("retryableExceptions", retryableExceptionNames);
        map.put("trackFailures", trackFailures);
        return map;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Total wall-clock budget across all retries, or null for no limit. */
    public Duration getMaxRetryDuration() {
        return maxRetryDuration;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    public double getJitterMin() {
        return jitterMin;
    }

    public double getJitterMax() {
        return jitterMax;
    }

    /** Age after which a message is no longer retried, or null for no expiry. */
    public Duration getMessageTtl() {
        return messageTtl;
    }

    public Set<String> getNonRetryableExceptionNames() {
        return nonRetryableExceptionNames;
    }

    /** Whitelist of retryable exception names, or null when every other exception is retryable. */
    public Set<String> getRetryableExceptionNames() {
        return retryableExceptionNames;
    }

    public boolean isTrackFailures() {
        return trackFailures;
    }

    @Override
    public String toString() {
        return "DlqConfig" + toMap();
    }

    public static class Builder {
        private boolean enabled = true;
        private int maxRetries = 5;
        private Duration maxRetryDuration;
        private RetryPolicy retryPolicy = RetryPolicy.EXPONENTIAL;
        private Duration initialDelay = Duration.ofMillis(1000);
        private Duration maxDelay = Duration.ofMillis(60_000);
        private double retryMultiplier = 2.0;
        private boolean jitterEnabled = true;
        private double jitterMin = 0.5;
        private double jitterMax = 1.5;
        private Duration messageTtl = Duration.ofHours(24);
        private Set<String> nonRetryableExceptionNames = new LinkedHashSet<>(DEFAULT_NON_RETRYABLE_EXCEPTIONS);
        private Set<String> retryableExceptionNames;
        private boolean trackFailures = true;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
                throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxRetryDuration(Duration maxRetryDuration) {
            if (maxRetryDuration != null && maxRetryDuration.compareTo(Duration.ofSeconds(1)) < 0) {
                throw new IllegalArgumentException("maxRetryDuration must be >= 1s");
            }
            this.maxRetryDuration = maxRetryDuration;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            Objects.requireNonNull(initialDelay, "initialDelay");
            if (initialDelay.toMillis() < 100 || initialDelay.toMillis() > 60_000) {
                throw new IllegalArgumentException("initialDelay must be between 100ms and 60s");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.toMillis() < 1000 || maxDelay.toMillis() > 3_600_000) {
                throw new IllegalArgumentException("maxDelay must be between 1s and 1h");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryMultiplier(double retryMultiplier) {
            if (!(retryMultiplier >= 1.0 && retryMultiplier <= 10.0)) {
                throw new IllegalArgumentException("retryMultiplier must be between 1.0 and 10.0");
            }
            this.retryMultiplier = retryMultiplier;
            return this;
        }

        public Builder jitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        public Builder jitterRange(double min, double max) {
            if (!(min > 0) || !(max > 0)) {
                throw new IllegalArgumentException("jitterRange values must be positive");
            }
            if (min >= max) {
                throw new IllegalArgumentException(
                        String.format("jitterRange min (%s) must be < max (%s)", min, max));
            }
            this.jitterMin = min;
            this.jitterMax = max;
            return this;
        }

        public Builder messageTtl(Duration messageTtl) {
            if (messageTtl != null && messageTtl.compareTo(Duration.ofMinutes(1)) < 0) {
                throw new IllegalArgumentException("messageTtl must be >= 60s");
            }
            this.messageTtl = messageTtl;
            return this;
        }

        /** Replaces the non-retryable names, defaults included. */
        public Builder nonRetryableExceptions(Collection<String> names) {
            this.nonRetryableExceptionNames = new LinkedHashSet<>(Objects.requireNonNull(names, "names"));
            return this;
        }

        /** Adds to the non-retryable names, keeping what is already there. */
        public Builder addNonRetryableExceptions(String... names) {
            this.nonRetryableExceptionNames.addAll(Arrays.asList(names));
            return this;
        }

        /** Null clears the whitelist. */
        public Builder retryableExceptions(Collection<String> names) {
            this.retryableExceptionNames = names == null ? null : new LinkedHashSet<>(names);
            return this;
        }

        public Builder trackFailures(boolean trackFailures) {
            this.trackFailures = trackFailures;
            return this;
        }

        public DlqConfig build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException(String.format(
                        "maxDelay (%d ms) must be >= initialDelay (%d ms)",
                        maxDelay.toMillis(), initialDelay.toMillis()));
            }
            return new DlqConfig(this);
        }
    }
}
