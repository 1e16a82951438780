package com.coagent.workflow.core.engine.notification.impl;

import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Writes notifications to the log. Default sink when no webhook is configured.
 */
@Slf4j
public class ConsoleNotificationSink implements ICoAgentNotificationSink {

    @Override
    public Mono<String> notify(String recipient, Map<String, Object> payload) {
        return Mono.fromCallable(() -> {
            String notificationId = "console-" + UUID.randomUUID();
            log.info("[NOTIFICATION] id={} to={} subject={} message={}",
                    notificationId,
                    recipient,
                    payload.getOrDefault("subject", payload.get("title")),
                    payload.get("message"));
            return notificationId;
        });
    }
}
