package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Risk attached to an approval request. Declaration order is severity order.
 */
@Getter
@AllArgsConstructor
public enum CoAgentRiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    public boolean isBelow(CoAgentRiskLevel threshold) {
        return this.ordinal() < threshold.ordinal();
    }

    public boolean isAtLeast(CoAgentRiskLevel threshold) {
        return this.ordinal() >= threshold.ordinal();
    }

    public static Optional<CoAgentRiskLevel> fromValue(String value) {
        return Arrays.stream(values())
                .filter(level -> level.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
