package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum CoAgentApprovalDecisionType {
    APPROVE("approve"),
    REJECT("reject");

    private final String value;

    public static Optional<CoAgentApprovalDecisionType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
