package com.coagent.workflow.core.exception.codes;

import com.coagent.workflow.integration.contract.ICoAgentErrorInfo;
import com.coagent.workflow.integration.enumerations.CoAgentHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CoAgentInternalErrorCodes implements ICoAgentErrorInfo {

    STATE_VALIDATION_FAILED(
            "COAGENT_ERR_0001",
            CoAgentHttpStatus.BAD_REQUEST,
            "Initial state does not satisfy the schema of workflow [%s]"
    ),

    WORKFLOW_NOT_FOUND(
            "COAGENT_ERR_0002",
            CoAgentHttpStatus.NOT_FOUND,
            "Workflow Not Found. Identifier: [%s]"
    ),

    THREAD_NOT_FOUND(
            "COAGENT_ERR_0003",
            CoAgentHttpStatus.NOT_FOUND,
            "Thread Not Found. Identifier: [%s]"
    ),

    INVALID_RESUME(
            "COAGENT_ERR_0004",
            CoAgentHttpStatus.CONFLICT,
            "Thread [%s] cannot be resumed: %s"
    ),

    CHECKPOINT_CONFLICT(
            "COAGENT_ERR_0005",
            CoAgentHttpStatus.CONFLICT,
            "Checkpoint conflict on thread [%s]: %s"
    ),

    RECURSION_LIMIT_EXCEEDED(
            "COAGENT_ERR_0006",
            CoAgentHttpStatus.INTERNAL_SERVER_ERROR,
            "Thread [%s] exceeded the node visit limit of %s"
    ),

    NODE_EXECUTION_FAILED(
            "COAGENT_ERR_0007",
            CoAgentHttpStatus.INTERNAL_SERVER_ERROR,
            "Node [%s] of thread [%s] failed: %s"
    ),

    CHECKPOINT_PERSISTENCE_FAILED(
            "COAGENT_ERR_0008",
            CoAgentHttpStatus.SERVICE_UNAVAILABLE,
            "Checkpoint store unavailable while %s thread [%s]"
    ),

    NOTIFICATION_DELIVERY_FAILED(
            "COAGENT_ERR_0009",
            CoAgentHttpStatus.BAD_GATEWAY,
            "Notification to [%s] could not be delivered"
    ),

    INVALID_WORKFLOW_DEFINITION(
            "COAGENT_ERR_0010",
            CoAgentHttpStatus.BAD_REQUEST,
            "Workflow definition [%s] is invalid: %s"
    ),

    INVALID_REQUEST(
            "COAGENT_ERR_0011",
            CoAgentHttpStatus.BAD_REQUEST,
            "Request is invalid: %s"
    )

    ;

    private final String errorCode;
    private final CoAgentHttpStatus httpStatus;
    private final String errorTemplate;

    public String format(Object... arguments) {
        return String.format(errorTemplate, arguments);
    }
}
