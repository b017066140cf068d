package com.aporkolab.dlq.alerting;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One dead-letter event as reported to humans.
 */
@JsonPropertyOrder({"timestamp", "severity", "destination", "error_type", "error_message",
        "retry_count", "reason", "message_preview", "metadata"})
public class DlqAlert {

    private final Instant timestamp;
    private final AlertSeverity severity;
    private final String destination;
    private final String errorType;
    private final String errorMessage;
    private final int retryCount;
    private final String reason;
    private final String messagePreview;
    private final Map<String, Object> metadata;

    public DlqAlert(Instant timestamp, AlertSeverity severity, String destination, String errorType,
                    String errorMessage, int retryCount, String reason, String messagePreview,
                    Map<String, Object> metadata) {
        this.timestamp = timestamp;
        this.severity = severity;
        this.destination = destination;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.retryCount = retryCount;
        this.reason = reason;
        this.messagePreview = messagePreview;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String formatSubject() {
        return String.format("DLQ Alert [%s]: %s - %s", severity.name(), destination, errorType);
    }

    public String formatBody() {
        StringBuilder body = new StringBuilder()
                .append("DLQ Alert - ").append(severity.name()).append('\n')
                .append("=".repeat(50)).append('\n')
                .append("Timestamp: ").append(timestamp).append('\n')
                .append("Destination: ").append(destination).append('\n')
                .append("Error Type: ").append(errorType).append('\n')
                .append("Error Message: ").append(errorMessage).append('\n')
                .append("Retry Count: ").append(retryCount);
        if (reason != null) {
            body.append('\n').append("Reason: ").append(reason);
        }

        if (messagePreview != null && !messagePreview.isEmpty()) {
            body.append("\n\nMessage Preview:\n").append("-".repeat(30)).append('\n').append(messagePreview);
        }

        if (!metadata.isEmpty()) {
            body.append("\n\nMetadata:\n").append("-".repeat(30));
            metadata.forEach((key, value) -> body.append("\n  ").append(key).append(": ").append(value));
        }
        return body.toString();
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("severity")
    public AlertSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("destination")
    public String getDestination() {
        return destination;
    }

    @JsonProperty("error_type")
    public String getErrorType() {
        return errorType;
    }

    @JsonProperty("error_message")
    public String getErrorMessage() {
        return errorMessage;
    }

    @JsonProperty("retry_count")
    public int getRetryCount() {
        return retryCount;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @JsonProperty("message_preview")
    public String getMessagePreview() {
        return messagePreview;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
