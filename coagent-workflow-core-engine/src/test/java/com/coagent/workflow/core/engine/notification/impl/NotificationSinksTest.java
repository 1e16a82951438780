package com.coagent.workflow.core.engine.notification.impl;

import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationSinksTest {

    private static final Map<String, Object> PAYLOAD = Map.of("subject", "HIGH: hotel_o2c - timeout", "message", "overdue");

    @Test
    @DisplayName("the console sink answers with a console id")
    void console() {
        StepVerifier.create(new ConsoleNotificationSink().notify("Administrator", PAYLOAD))
                .assertNext(id -> assertThat(id).startsWith("console-"))
                .verifyComplete();
    }

    @Test
    @DisplayName("the composite sink delivers to every sink in order")
    void composite() {
        List<String> delivered = new ArrayList<>();
        ICoAgentNotificationSink first = (recipient, payload) -> Mono.fromSupplier(() -> {
            delivered.add("first:" + recipient);
            return "a";
        });
        ICoAgentNotificationSink second = (recipient, payload) -> Mono.fromSupplier(() -> {
            delivered.add("second:" + recipient);
            return "b";
        });

        StepVerifier.create(new CompositeNotificationSink(List.of(first, second)).notify("Ops", PAYLOAD))
                .expectNext("a,b")
                .verifyComplete();
        assertThat(delivered).containsExactly("first:Ops", "second:Ops");
    }

    @Test
    @DisplayName("the webhook sink posts once on success")
    void webhookSuccess() {
        List<ClientRequest> requests = new ArrayList<>();
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                })
                .build();

        StepVerifier.create(new WebhookNotificationSink(client, "http://hooks.local/notify").notify("Administrator", PAYLOAD))
                .assertNext(id -> assertThat(id).isNotBlank())
                .verifyComplete();
        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().toString()).isEqualTo("http://hooks.local/notify");
        });
    }

    @Test
    @DisplayName("the webhook sink retries server errors")
    void webhookRetriesServerErrors() {
        AtomicInteger calls = new AtomicInteger();
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse
                        .create(calls.incrementAndGet() < 3 ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                        .build()))
                .build();
        WebhookNotificationSink sink = new WebhookNotificationSink(client, "http://hooks.local/notify")
                .withRetryBackoff(Duration.ofMillis(1));

        StepVerifier.create(sink.notify("Administrator", PAYLOAD))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("the webhook sink does not retry a client error")
    void webhookClientError() {
        AtomicInteger calls = new AtomicInteger();
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST).build());
                })
                .build();

        StepVerifier.create(new WebhookNotificationSink(client, "http://hooks.local/notify").notify("Administrator", PAYLOAD))
                .expectError(WebClientResponseException.class)
                .verify();
        assertThat(calls.get()).isEqualTo(1);
    }
}
