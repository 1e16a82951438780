package com.coagent.workflow.core.exception.notification;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CoAgentNotificationDeliveryException extends CoAgentWorkflowException {
    private final String recipient;

    public CoAgentNotificationDeliveryException(String recipient, Throwable cause) {
        super(CoAgentInternalErrorCodes.NOTIFICATION_DELIVERY_FAILED, Map.of(), cause, recipient);
        this.recipient = recipient;
    }

    @Override
    public boolean isInfrastructureFailure() {
        return true;
    }
}
