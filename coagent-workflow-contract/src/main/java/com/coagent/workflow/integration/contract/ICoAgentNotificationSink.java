package com.coagent.workflow.integration.contract;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * External notification collaborator used by escalations and notify steps.
 *
 * <p>The engine treats the sink as opaque: it hands over a recipient and a structured payload
 * and expects either the identifier the transport assigned to the notification or an error
 * signal. Delivery failures are infrastructure failures and are never swallowed by the engine.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ICoAgentNotificationSink sink = (recipient, payload) -> mailer.send(recipient, payload);
 * sink.notify("Administrator", Map.of("subject", "HIGH: hotel_o2c - timeout"))
 *     .subscribe(id -> log.info("sent {}", id));
 * }</pre>
 */
@FunctionalInterface
public interface ICoAgentNotificationSink {

    /**
     * Delivers a notification.
     *
     * @param recipient the addressee, a person, role or channel name
     * @param payload structured content of the notification
     * @return the notification id assigned by the transport
     */
    Mono<String> notify(String recipient, Map<String, Object> payload);
}
