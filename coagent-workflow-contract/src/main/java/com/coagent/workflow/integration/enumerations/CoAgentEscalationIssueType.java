package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CoAgentEscalationIssueType {
    TIMEOUT("timeout"),
    ERROR("error"),
    APPROVAL_REQUIRED("approval_required"),
    QUALITY_ISSUE("quality_issue"),
    CUSTOM("custom");

    private final String value;
}
