package com.aporkolab.dlq.alerting;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Posts alerts to a chat webhook.
 *
 * The payload is Slack-compatible ({@code text} + {@code attachments}) and also
 * carries the raw alert under {@code alert} for other receivers. Delivery is
 * asynchronous and failures are only logged.
 */
public class WebhookAlertSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSender.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI webhookUrl;
    private final Duration timeout;

    public WebhookAlertSender(URI webhookUrl, Duration timeout, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), webhookUrl, timeout, objectMapper);
    }

    WebhookAlertSender(HttpClient httpClient, URI webhookUrl, Duration timeout, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    /**
     * @return completes with true on a 2xx response, false otherwise; never completes exceptionally
     */
    public CompletableFuture<Boolean> send(DlqAlert alert) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload(alert));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize DLQ alert for {}: {}", alert.getDestination(), e.getMessage(), e);
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(webhookUrl)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        log.warn("DLQ webhook alert rejected by {} with status {}", webhookUrl, response.statusCode());
                        return false;
                    }
                    log.debug("DLQ webhook alert sent to {}", webhookUrl);
                    return true;
                })
                .exceptionally(ex -> {
                    log.error("Failed to send DLQ webhook alert to {}: {}", webhookUrl, ex.getMessage(), ex);
                    return false;
                });
    }

    static Map<String, Object> payload(DlqAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", alert.formatSubject());
        payload.put("attachments", List.of(Map.of(
                "color", alert.getSeverity().color(),
                "fields", List.of(
                        field("Destination", alert.getDestination(), true),
                        field("Error Type", alert.getErrorType(), true),
                        field("Retry Count", String.valueOf(alert.getRetryCount()), true),
                        field("Severity", alert.getSeverity().label(), true),
                        field("Error Message", alert.getErrorMessage(), false)))));
        payload.put("alert", alert);
        return payload;
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value == null ? "" : value);
        field.put("short", isShort);
        return field;
    }
}
