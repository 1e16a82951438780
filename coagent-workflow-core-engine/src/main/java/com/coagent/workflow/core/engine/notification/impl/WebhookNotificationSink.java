package com.coagent.workflow.core.engine.notification.impl;

import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Posts every notification as JSON to a webhook.
 *
 * <h2>Request Body</h2>
 * <pre>{@code
 * {
 *   "notification_id": "c5a4...",
 *   "recipient": "Administrator",
 *   "payload": { "subject": "HIGH: hotel_o2c - timeout", ... }
 * }
 * }</pre>
 *
 * <p>Server errors and connection failures are retried; a notification that still cannot be
 * delivered is reported as an error signal to the caller.</p>
 */
@Slf4j
public class WebhookNotificationSink implements ICoAgentNotificationSink {

    private final WebClient webClient;
    private final String url;
    private int retryAttempts = 3;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private Duration timeout = Duration.ofSeconds(10);

    public WebhookNotificationSink(String url) {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build(), url);
    }

    public WebhookNotificationSink(WebClient webClient, String url) {
        this.webClient = webClient;
        this.url = url;
        log.info("WebhookNotificationSink initialized for {}", url);
    }

    public WebhookNotificationSink withRetryAttempts(int attempts) {
        this.retryAttempts = attempts;
        return this;
    }

    public WebhookNotificationSink withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public WebhookNotificationSink withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    @Override
    public Mono<String> notify(String recipient, Map<String, Object> payload) {
        String notificationId = UUID.randomUUID().toString();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("notification_id", notificationId);
        body.put("recipient", recipient);
        body.put("payload", payload);

        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .retryWhen(Retry.backoff(retryAttempts, retryBackoff)
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.warn(
                                "Retrying webhook {} for notification {}, attempt {}",
                                url, notificationId, signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(response -> log.debug("Webhook notification sent: url={}, id={}, status={}",
                        url, notificationId, response.getStatusCode()))
                .doOnError(error -> log.error("Webhook notification failed: url={}, id={}, error={}",
                        url, notificationId, error.getMessage()))
                .thenReturn(notificationId);
    }

    private boolean isRetryableError(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return error instanceof WebClientRequestException
                || error instanceof TimeoutException;
    }
}
