package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Status of one thread (one logical execution) of a workflow.
 */
@Getter
@AllArgsConstructor
public enum CoAgentExecutionStatus {

    /**
     * Nodes are being executed.
     */
    RUNNING("running", false),

    /**
     * Suspended at an approval gate, waiting for a decision.
     */
    PAUSED("paused", false),

    COMPLETED("completed", true),

    /**
     * An approval gate was rejected and the workflow ended on its rejection path.
     */
    REJECTED("rejected", true),

    ERROR("error", true),

    CANCELLED("cancelled", true);

    private final String value;
    private final boolean terminal;

    public static Optional<CoAgentExecutionStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
