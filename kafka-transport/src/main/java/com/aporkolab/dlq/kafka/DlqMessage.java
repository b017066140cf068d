package com.aporkolab.dlq.kafka;

import java.time.Instant;

/**
 * Enriched message stored in the Kafka dead-letter topic.
 * Contains all context needed for debugging and replay.
 */
public class DlqMessage {

    private String originalTopic;
    private int originalPartition;
    private long originalOffset;
    private String originalKey;
    private String originalValue;
    private Instant originalTimestamp;
    private String reason;
    private String errorType;
    private String errorMessage;
    private int retryCount;
    private Instant failedAt;
    private String hostname;

    private DlqMessage() {}

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public String getOriginalTopic() { return originalTopic; }
    public int getOriginalPartition() { return originalPartition; }
    public long getOriginalOffset() { return originalOffset; }
    public String getOriginalKey() { return originalKey; }
    public String getOriginalValue() { return originalValue; }
    public Instant getOriginalTimestamp() { return originalTimestamp; }
    public String getReason() { return reason; }
    public String getErrorType() { return errorType; }
    public String getErrorMessage() { return errorMessage; }
    public int getRetryCount() { return retryCount; }
    public Instant getFailedAt() { return failedAt; }
    public String getHostname() { return hostname; }

    public static class Builder {
        private final DlqMessage message = new DlqMessage();

        public Builder originalTopic(String originalTopic) {
            message.originalTopic = originalTopic;
            return this;
        }

        public Builder originalPartition(int originalPartition) {
            message.originalPartition = originalPartition;
            return this;
        }

        public Builder originalOffset(long originalOffset) {
            message.originalOffset = originalOffset;
            return this;
        }

        public Builder originalKey(String originalKey) {
            message.originalKey = originalKey;
            return this;
        }

        public Builder originalValue(String originalValue) {
            message.originalValue = originalValue;
            return this;
        }

        public Builder originalTimestamp(Instant originalTimestamp) {
            message.originalTimestamp = originalTimestamp;
            return this;
        }

        public Builder reason(String reason) {
            message.reason = reason;
            return this;
        }

        public Builder errorType(String errorType) {
            message.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            message.errorMessage = errorMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            message.retryCount = retryCount;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            message.failedAt = failedAt;
            return this;
        }

        public Builder hostname(String hostname) {
            message.hostname = hostname;
            return this;
        }

        public DlqMessage build() {
            return message;
        }
    }
}
