package com.coagent.workflow.core.exception;

import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import com.coagent.workflow.integration.contract.ICoAgentErrorInfo;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the errors the engine surfaces to its callers. Each carries the error code that
 * decides how the HTTP surface reports it.
 */
@Getter
public class CoAgentWorkflowException extends RuntimeException {
    private final ICoAgentErrorInfo errorInfo;
    private final Map<String, Object> details;

    public CoAgentWorkflowException(CoAgentInternalErrorCodes errorInfo, Map<String, Object> details, Throwable cause, Object... arguments) {
        super(errorInfo.format(arguments), cause);
        this.errorInfo = errorInfo;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public CoAgentWorkflowException(CoAgentInternalErrorCodes errorInfo, Object... arguments) {
        this(errorInfo, Map.of(), null, arguments);
    }

    public boolean isInfrastructureFailure() {
        return false;
    }
}
