package com.coagent.workflow.integration.models.events;

/**
 * Receiver of progress events for one thread. Called in sequence order, one event at a time.
 */
@FunctionalInterface
public interface ICoAgentEventSink {
    void push(CoAgentProgressEvent event);
}
