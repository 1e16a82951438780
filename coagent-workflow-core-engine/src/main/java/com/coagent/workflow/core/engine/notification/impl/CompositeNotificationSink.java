package com.coagent.workflow.core.engine.notification.impl;

import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fans a notification out to several sinks. Succeeds when every sink succeeded; the returned
 * id joins the ids of the individual deliveries.
 */
@Slf4j
public class CompositeNotificationSink implements ICoAgentNotificationSink {

    private final List<ICoAgentNotificationSink> sinks;

    public CompositeNotificationSink(List<ICoAgentNotificationSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public Mono<String> notify(String recipient, Map<String, Object> payload) {
        return Flux.fromIterable(sinks)
                .concatMap(sink -> sink.notify(recipient, payload))
                .collect(Collectors.joining(","));
    }
}
