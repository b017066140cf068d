package com.aporkolab.dlq.spring.autoconfigure;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.config.RetryPolicy;

/**
 * Configuration properties for the DLQ retry engine.
 *
 * Every setting can also come from the environment through relaxed binding,
 * e.g. {@code DLQ_MAX_RETRIES=3} or {@code DLQ_RETRY_POLICY=linear}.
 *
 * Example application.yml:
 * <pre>
 * dlq:
 *   max-retries: 5
 *   retry-policy: exponential
 *   initial-delay-ms: 1000
 *   max-delay-ms: 60000
 *   jitter-enabled: true
 *   message-ttl-ms: 86400000
 *   transport: kafka
 *   poison:
 *     threshold: 3
 *   alert:
 *     channels: [log, webhook]
 *     webhook-url: https://hooks.slack.com/services/...
 * </pre>
 */
@ConfigurationProperties(prefix = "dlq")
public class DlqProperties {

    public enum Transport {
        KAFKA,
        AMQP
    }

    private boolean enabled = true;
    private int maxRetries = 5;
    /** Wall-clock retry budget; unset means unbounded. */
    private Long maxRetryDurationMs;
    private RetryPolicy retryPolicy = RetryPolicy.EXPONENTIAL;
    private long initialDelayMs = 1000;
    private long maxDelayMs = 60_000;
    private double retryMultiplier = 2.0;
    private boolean jitterEnabled = true;
    private double jitterMin = 0.5;
    private double jitterMax = 1.5;
    /** Message TTL; zero or negative disables the check. */
    private long messageTtlMs = 86_400_000L;
    /** Replaces the default non-retryable exception names when set. */
    private List<String> nonRetryableExceptions;
    private List<String> additionalNonRetryableExceptions = new ArrayList<>();
    /** Whitelist; when set only these exception names are retried. */
    private List<String> retryableExceptions;
    private boolean trackFailures = true;
    private Transport transport = Transport.KAFKA;

    private PoisonProperties poison = new PoisonProperties();
    private AlertProperties alert = new AlertProperties();
    private KafkaProperties kafka = new KafkaProperties();
    private ReplayProperties replay = new ReplayProperties();
    private MetricsProperties metrics = new MetricsProperties();

    /**
     * Builds the validated engine configuration.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public DlqConfig toDlqConfig() {
        DlqConfig.Builder builder = DlqConfig.builder()
                .enabled(enabled)
                .maxRetries(maxRetries)
                .maxRetryDuration(maxRetryDurationMs == null ? null : Duration.ofMillis(maxRetryDurationMs))
                .retryPolicy(retryPolicy)
                .initialDelay(Duration.ofMillis(initialDelayMs))
                .maxDelay(Duration.ofMillis(maxDelayMs))
                .retryMultiplier(retryMultiplier)
                .jitterEnabled(jitterEnabled)
                .jitterRange(jitterMin, jitterMax)
                .messageTtl(messageTtlMs > 0 ? Duration.ofMillis(messageTtlMs) : null)
                .retryableExceptions(retryableExceptions)
                .trackFailures(trackFailures);
        if (nonRetryableExceptions != null) {
            builder.nonRetryableExceptions(nonRetryableExceptions);
        }
        builder.addNonRetryableExceptions(additionalNonRetryableExceptions.toArray(new String[0]));
        return builder.build();
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Long getMaxRetryDurationMs() {
        return maxRetryDurationMs;
    }

    public void setMaxRetryDurationMs(Long maxRetryDurationMs) {
        this.maxRetryDurationMs = maxRetryDurationMs;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public void setRetryMultiplier(double retryMultiplier) {
        this.retryMultiplier = retryMultiplier;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
        this.jitterEnabled = jitterEnabled;
    }

    public double getJitterMin() {
        return jitterMin;
    }

    public void setJitterMin(double jitterMin) {
        this.jitterMin = jitterMin;
    }

    public double getJitterMax() {
        return jitterMax;
    }

    public void setJitterMax(double jitterMax) {
        this.jitterMax = jitterMax;
    }

    public long getMessageTtlMs() {
        return messageTtlMs;
    }

    public void setMessageTtlMs(long messageTtlMs) {
        this.messageTtlMs = messageTtlMs;
    }

    public List<String> getNonRetryableExceptions() {
        return nonRetryableExceptions;
    }

    public void setNonRetryableExceptions(List<String> nonRetryableExceptions) {
        this.nonRetryableExceptions = nonRetryableExceptions;
    }

    public List<String> getAdditionalNonRetryableExceptions() {
        return additionalNonRetryableExceptions;
    }

    public void setAdditionalNonRetryableExceptions(List<String> additionalNonRetryableExceptions) {
        this.additionalNonRetryableExceptions = additionalNonRetryableExceptions;
    }

    public List<String> getRetryableExceptions() {
        return retryableExceptions;
    }

    public void setRetryableExceptions(List<String> retryableExceptions) {
        this.retryableExceptions = retryableExceptions;
    }

    public boolean isTrackFailures() {
        return trackFailures;
    }

    public void setTrackFailures(boolean trackFailures) {
        this.trackFailures = trackFailures;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public PoisonProperties getPoison() {
        return poison;
    }

    public void setPoison(PoisonProperties poison) {
        this.poison = poison;
    }

    public AlertProperties getAlert() {
        return alert;
    }

    public void setAlert(AlertProperties alert) {
        this.alert = alert;
    }

    public KafkaProperties getKafka() {
        return kafka;
    }

    public void setKafka(KafkaProperties kafka) {
        this.kafka = kafka;
    }

    public ReplayProperties getReplay() {
        return replay;
    }

    public void setReplay(ReplayProperties replay) {
        this.replay = replay;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    // ==================== Nested Properties ====================

    public static class PoisonProperties {
        private boolean enabled = true;
        private int threshold = 3;
        private int maxEntries = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    public static class AlertProperties {
        private boolean enabled = true;
        /** Channel names, {@code log} or {@code webhook}. */
        private Set<String> channels = new LinkedHashSet<>(List.of("log"));
        private URI webhookUrl;
        private long webhookTimeoutMs = 10_000;
        private long rateLimitSeconds = 60;
        private int warningThreshold = 3;
        private int criticalThreshold = 5;
        private boolean includeMessagePreview = true;
        private int maxPreviewLength = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Set<String> getChannels() {
            return channels;
        }

        public void setChannels(Set<String> channels) {
            this.channels = channels;
        }

        public URI getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(URI webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public long getWebhookTimeoutMs() {
            return webhookTimeoutMs;
        }

        public void setWebhookTimeoutMs(long webhookTimeoutMs) {
            this.webhookTimeoutMs = webhookTimeoutMs;
        }

        public long getRateLimitSeconds() {
            return rateLimitSeconds;
        }

        public void setRateLimitSeconds(long rateLimitSeconds) {
            this.rateLimitSeconds = rateLimitSeconds;
        }

        public int getWarningThreshold() {
            return warningThreshold;
        }

        public void setWarningThreshold(int warningThreshold) {
            this.warningThreshold = warningThreshold;
        }

        public int getCriticalThreshold() {
            return criticalThreshold;
        }

        public void setCriticalThreshold(int criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
        }

        public boolean isIncludeMessagePreview() {
            return includeMessagePreview;
        }

        public void setIncludeMessagePreview(boolean includeMessagePreview) {
            this.includeMessagePreview = includeMessagePreview;
        }

        public int getMaxPreviewLength() {
            return maxPreviewLength;
        }

        public void setMaxPreviewLength(int maxPreviewLength) {
            this.maxPreviewLength = maxPreviewLength;
        }
    }

    public static class KafkaProperties {
        private String dlqSuffix = ".dlq";
        private long sendTimeoutMs = 10_000;
        /** Must match the consumer's max.poll.interval.ms; retry waits have to fit inside it. */
        private long maxPollIntervalMs = 300_000;

        public String getDlqSuffix() {
            return dlqSuffix;
        }

        public void setDlqSuffix(String dlqSuffix) {
            this.dlqSuffix = dlqSuffix;
        }

        public long getSendTimeoutMs() {
            return sendTimeoutMs;
        }

        public void setSendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
        }

        public long getMaxPollIntervalMs() {
            return maxPollIntervalMs;
        }

        public void setMaxPollIntervalMs(long maxPollIntervalMs) {
            this.maxPollIntervalMs = maxPollIntervalMs;
        }
    }

    public static class ReplayProperties {
        private int maxRetryCount = 5;

        public int getMaxRetryCount() {
            return maxRetryCount;
        }

        public void setMaxRetryCount(int maxRetryCount) {
            this.maxRetryCount = maxRetryCount;
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;
        private String name = "default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
