package com.coagent.workflow.core.engine.execution.impl;

import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

@Getter
@Builder
class CoAgentNodeContext implements ICoAgentNodeContext {
    private final String threadId;
    private final String workflowName;
    private final String nodeName;
    private final Map<String, Object> sessionContext;
    private final ICoAgentNotificationSink notificationSink;
    private final ICoAgentDocumentClient documentClient;

    @Getter(lombok.AccessLevel.NONE)
    private final BooleanSupplier cancelled;

    @Getter(lombok.AccessLevel.NONE)
    private final BiConsumer<CoAgentProgressEventType, Map<String, Object>> emitter;

    @Override
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    @Override
    public void emit(CoAgentProgressEventType type, Map<String, Object> payload) {
        emitter.accept(type, payload);
    }
}
