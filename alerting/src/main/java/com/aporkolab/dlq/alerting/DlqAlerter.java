package com.aporkolab.dlq.alerting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.dlq.middleware.RetryDecision;
import com.aporkolab.dlq.middleware.RetryListener;
import com.aporkolab.dlq.state.RetryState;
import com.aporkolab.dlq.transport.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Tells humans when messages land in the dead-letter queue.
 *
 * Design decisions:
 * - Rate limited per destination and error type, so a broken consumer raises one alert per interval
 * - Severity follows the retry count: many retries means a long-running outage
 * - Alerting never fails the delivery: channel errors are logged and swallowed
 *
 * Register as a {@link RetryListener} on the retry middleware, or call
 * {@link #alert} directly from custom routing code.
 */
public class DlqAlerter implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(DlqAlerter.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 200;

    private final AlertConfig config;
    private final AlertRateLimiter rateLimiter;
    private final WebhookAlertSender webhookSender;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DlqAlerter(AlertConfig config) {
        this(config, defaultObjectMapper(), Clock.systemUTC());
    }

    public DlqAlerter(AlertConfig config, ObjectMapper objectMapper, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rateLimiter = new AlertRateLimiter(config.getRateLimit(), clock);
        this.webhookSender = config.getWebhookUrl() == null
                ? null
                : new WebhookAlertSender(config.getWebhookUrl(), config.getWebhookTimeout(), objectMapper);
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public void onDeadLettered(InboundMessage message, RetryDecision decision, RetryState state, Throwable error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (message.messageId() != null) {
            metadata.put("messageId", message.messageId());
        }
        alert(String.valueOf(message.destination()),
                error == null ? "unknown" : error.getClass().getSimpleName(),
                error == null ? null : error.getMessage(),
                state.getCount(),
                decision.getReasonCode(),
                message.body(),
                metadata);
    }

    /**
     * Sends an alert to every configured channel.
     *
     * @return false when alerting is disabled or the alert was rate limited
     */
    public boolean alert(String destination, String errorType, String errorMessage, int retryCount,
                         String reason, byte[] body, Map<String, Object> metadata) {
        if (!config.isEnabled()) {
            return false;
        }

        String rateKey = destination + ":" + errorType;
        if (!rateLimiter.tryAcquire(rateKey)) {
            log.debug("DLQ alert rate limited for {}", rateKey);
            return false;
        }

        String truncatedError = truncate(errorMessage == null ? "" : errorMessage);
        DlqAlert alert = new DlqAlert(
                clock.instant(),
                AlertSeverity.forRetryCount(retryCount, config.getWarningThreshold(), config.getCriticalThreshold()),
                destination,
                errorType,
                truncatedError.length() > MAX_ERROR_MESSAGE_LENGTH
                        ? truncatedError.substring(0, MAX_ERROR_MESSAGE_LENGTH)
                        : truncatedError,
                retryCount,
                reason,
                config.isIncludeMessagePreview() ? preview(body) : null,
                metadata);

        for (AlertChannel channel : config.getChannels()) {
            switch (channel) {
                case LOG -> logAlert(alert);
                case WEBHOOK -> sendWebhook(alert);
            }
        }
        return true;
    }

    private void logAlert(DlqAlert alert) {
        switch (alert.getSeverity()) {
            case INFO -> log.info("DLQ alert: {} in {} after {} retries ({})",
                    alert.getErrorType(), alert.getDestination(), alert.getRetryCount(), alert.getReason());
            case WARNING -> log.warn("DLQ alert: {} in {} after {} retries ({})",
                    alert.getErrorType(), alert.getDestination(), alert.getRetryCount(), alert.getReason());
            case CRITICAL -> log.error("DLQ alert: {} in {} after {} retries ({})",
                    alert.getErrorType(), alert.getDestination(), alert.getRetryCount(), alert.getReason());
        }
    }

    private CompletableFuture<Boolean> sendWebhook(DlqAlert alert) {
        if (webhookSender == null) {
            log.debug("No webhook URL configured for DLQ alerts");
            return CompletableFuture.completedFuture(false);
        }
        return webhookSender.send(alert);
    }

    /**
     * JSON bodies are pretty-printed, anything else is shown as text.
     */
    String preview(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        try {
            JsonNode json = objectMapper.readTree(text);
            if (json != null && json.isContainerNode()) {
                text = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
            }
        } catch (IOException notJson) {
            log.trace("Message body is not JSON, previewing as text");
        }
        return truncate(text);
    }

    private String truncate(String text) {
        int max = config.getMaxPreviewLength();
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }

    public AlertRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public AlertConfig getConfig() {
        return config;
    }
}
