package com.coagent.workflow.integration.models.node;

import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;

import java.util.Map;

/**
 * What the engine exposes to a running node besides the state.
 */
public interface ICoAgentNodeContext {

    String getThreadId();

    String getWorkflowName();

    String getNodeName();

    /**
     * Identity/session data supplied by the caller. Passed through untouched.
     */
    Map<String, Object> getSessionContext();

    ICoAgentNotificationSink getNotificationSink();

    ICoAgentDocumentClient getDocumentClient();

    boolean isCancelled();

    /**
     * Publishes an informational event on the thread's progress feed.
     */
    void emit(CoAgentProgressEventType type, Map<String, Object> payload);
}
