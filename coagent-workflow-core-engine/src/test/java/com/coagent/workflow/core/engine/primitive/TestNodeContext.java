package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.core.engine.document.impl.InMemoryDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Node context for running primitives outside the engine. Records emitted events and notifications.
 */
@Getter
class TestNodeContext implements ICoAgentNodeContext {

    private final String threadId = "thread-1";
    private final String workflowName = "test_flow";
    private final String nodeName;
    private final Map<String, Object> sessionContext = Map.of();
    private final ICoAgentDocumentClient documentClient = new InMemoryDocumentClient();
    private final List<Map<String, Object>> events = new ArrayList<>();
    private final List<String> recipients = new ArrayList<>();
    private ICoAgentNotificationSink notificationSink = (recipient, payload) -> Mono.fromSupplier(() -> {
        recipients.add(recipient);
        return "NOTIF-" + recipients.size();
    });

    TestNodeContext(String nodeName) {
        this.nodeName = nodeName;
    }

    TestNodeContext withSink(ICoAgentNotificationSink sink) {
        this.notificationSink = sink;
        return this;
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public void emit(CoAgentProgressEventType type, Map<String, Object> payload) {
        events.add(Map.of("type", type, "payload", payload));
    }
}
