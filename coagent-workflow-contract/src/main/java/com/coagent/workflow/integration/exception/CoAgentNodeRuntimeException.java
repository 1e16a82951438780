package com.coagent.workflow.integration.exception;

import com.coagent.workflow.integration.enumerations.CoAgentFailureKind;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Business failure raised by node logic. The failure kind tells retry steps whether
 * another attempt can succeed.
 */
@Getter
@ToString
public class CoAgentNodeRuntimeException extends RuntimeException {
    private final CoAgentFailureKind failureKind;
    private final Map<String, Object> additionalInfo;

    public CoAgentNodeRuntimeException(String message, CoAgentFailureKind failureKind, Map<String, Object> additionalInfo, Throwable rootCause) {
        super(message, rootCause);
        this.failureKind = failureKind;
        this.additionalInfo = additionalInfo == null ? Map.of() : Map.copyOf(additionalInfo);
    }

    public CoAgentNodeRuntimeException(String message, CoAgentFailureKind failureKind) {
        this(message, failureKind, Map.of(), null);
    }

    public CoAgentNodeRuntimeException(String message, CoAgentFailureKind failureKind, Throwable rootCause) {
        this(message, failureKind, Map.of(), rootCause);
    }

    public static CoAgentNodeRuntimeException transientFailure(String message) {
        return new CoAgentNodeRuntimeException(message, CoAgentFailureKind.TRANSIENT);
    }

    public static CoAgentNodeRuntimeException fatalFailure(String message) {
        return new CoAgentNodeRuntimeException(message, CoAgentFailureKind.FATAL);
    }
}
