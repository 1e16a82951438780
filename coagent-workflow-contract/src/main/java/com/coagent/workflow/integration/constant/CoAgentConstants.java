package com.coagent.workflow.integration.constant;

/**
 * Field names, defaults and decision labels shared between the engine and workflow plugins.
 */
public interface CoAgentConstants {

    // control fields carried by every execution state
    String CURRENT_NODE = "current_node";
    String STEPS_COMPLETED = "steps_completed";
    String ERRORS = "errors";
    String PENDING_APPROVAL = "pending_approval";

    // bookkeeping fields written by the reusable primitives
    String APPROVAL_DECISION = "approval_decision";
    String APPROVAL_COMMENT = "approval_comment";
    String ESCALATIONS = "escalations";
    String NOTIFICATIONS = "notifications";
    String RETRY_ATTEMPTS = "retry_attempts";

    // keys of an entry in the errors list
    String ERROR_NODE = "node";
    String ERROR_MESSAGE = "message";

    String DECISION_APPROVE = "approve";
    String DECISION_REJECT = "reject";
    String DECISION_AUTO_APPROVED = "auto_approved";

    int DEFAULT_RECURSION_LIMIT = 25;
    int DEFAULT_STREAM_BUFFER_SIZE = 256;
    String DEFAULT_ESCALATION_RECIPIENT = "Administrator";
}
