package com.aporkolab.dlq.alerting;

import java.net.URI;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for dead-letter alerts.
 *
 * Usage:
 * <pre>
 * AlertConfig config = AlertConfig.builder()
 *         .channels(AlertChannel.LOG, AlertChannel.WEBHOOK)
 *         .webhookUrl(URI.create("https://hooks.slack.com/services/..."))
 *         .criticalThreshold(5)
 *         .build();
 * </pre>
 */
public final class AlertConfig {

    private final boolean enabled;
    private final Set<AlertChannel> channels;
    private final URI webhookUrl;
    private final Duration webhookTimeout;
    private final Duration rateLimit;
    private final int warningThreshold;
    private final int criticalThreshold;
    private final boolean includeMessagePreview;
    private final int maxPreviewLength;

    private AlertConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.channels = Set.copyOf(builder.channels);
        this.webhookUrl = builder.webhookUrl;
        this.webhookTimeout = builder.webhookTimeout;
        this.rateLimit = builder.rateLimit;
        this.warningThreshold = builder.warningThreshold;
        this.criticalThreshold = builder.criticalThreshold;
        this.includeMessagePreview = builder.includeMessagePreview;
        this.maxPreviewLength = builder.maxPreviewLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AlertConfig defaults() {
        return builder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Set<AlertChannel> getChannels() {
        return channels;
    }

    public URI getWebhookUrl() {
        return webhookUrl;
    }

    public Duration getWebhookTimeout() {
        return webhookTimeout;
    }

    public Duration getRateLimit() {
        return rateLimit;
    }

    public int getWarningThreshold() {
        return warningThreshold;
    }

    public int getCriticalThreshold() {
        return criticalThreshold;
    }

    public boolean isIncludeMessagePreview() {
        return includeMessagePreview;
    }

    public int getMaxPreviewLength() {
        return maxPreviewLength;
    }

    public static class Builder {
        private boolean enabled = true;
        private Set<AlertChannel> channels = EnumSet.of(AlertChannel.LOG);
        private URI webhookUrl;
        private Duration webhookTimeout = Duration.ofSeconds(10);
        private Duration rateLimit = Duration.ofSeconds(60);
        private int warningThreshold = 3;
        private int criticalThreshold = 5;
        private boolean includeMessagePreview = true;
        private int maxPreviewLength = 500;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder channels(AlertChannel first, AlertChannel... rest) {
            this.channels = EnumSet.of(first, rest);
            return this;
        }

        public Builder channels(Set<AlertChannel> channels) {
            this.channels = channels.isEmpty() ? EnumSet.noneOf(AlertChannel.class) : EnumSet.copyOf(channels);
            return this;
        }

        public Builder webhookUrl(URI webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder webhookTimeout(Duration webhookTimeout) {
            this.webhookTimeout = Objects.requireNonNull(webhookTimeout, "webhookTimeout");
            return this;
        }

        public Builder rateLimit(Duration rateLimit) {
            Objects.requireNonNull(rateLimit, "rateLimit");
            if (rateLimit.isNegative()) {
                throw new IllegalArgumentException("rateLimit must not be negative");
            }
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder warningThreshold(int warningThreshold) {
            this.warningThreshold = warningThreshold;
            return this;
        }

        public Builder criticalThreshold(int criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
            return this;
        }

        public Builder includeMessagePreview(boolean includeMessagePreview) {
            this.includeMessagePreview = includeMessagePreview;
            return this;
        }

        public Builder maxPreviewLength(int maxPreviewLength) {
            if (maxPreviewLength < 4) {
                throw new IllegalArgumentException("maxPreviewLength must be >= 4");
            }
            this.maxPreviewLength = maxPreviewLength;
            return this;
        }

        public AlertConfig build() {
            if (criticalThreshold < warningThreshold) {
                throw new IllegalArgumentException(String.format(
                        "criticalThreshold (%d) must be >= warningThreshold (%d)",
                        criticalThreshold, warningThreshold));
            }
            return new AlertConfig(this);
        }
    }
}
