package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CoAgentProgressEventType {
    START("start", false),
    NODE_ENTER("node_enter", false),
    NODE_EXIT("node_exit", false),
    INTERRUPT("interrupt", false),
    RESUMED("resumed", false),
    NOTIFY("notify", false),
    ESCALATE("escalate", false),
    ERROR("error", true),
    COMPLETE("complete", true),
    CANCELLED("cancelled", true);

    private final String value;
    private final boolean terminal;
}
