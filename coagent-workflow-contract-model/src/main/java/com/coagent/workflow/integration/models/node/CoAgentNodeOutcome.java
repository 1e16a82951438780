package com.coagent.workflow.integration.models.node;

import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Result of running one node: continue to a successor, suspend for approval, or end the thread.
 *
 * <p>The set of variants is closed: the constructor is private, so {@link Continue},
 * {@link Suspend} and {@link Terminal} are the only outcomes the engine ever has to route.</p>
 */
@Getter
@ToString
public abstract class CoAgentNodeOutcome {

    private final CoAgentStatePatch patch;

    private CoAgentNodeOutcome(CoAgentStatePatch patch) {
        this.patch = patch == null ? CoAgentStatePatch.empty() : patch;
    }

    public static Continue next(String nextNode) {
        return new Continue(nextNode, CoAgentStatePatch.empty());
    }

    public static Continue next(String nextNode, CoAgentStatePatch patch) {
        return new Continue(nextNode, patch);
    }

    public static Suspend suspend(CoAgentApprovalRequest request, CoAgentStatePatch patch) {
        return new Suspend(request, patch);
    }

    public static Terminal terminal(CoAgentExecutionStatus status) {
        return new Terminal(status, CoAgentStatePatch.empty());
    }

    public static Terminal terminal(CoAgentExecutionStatus status, CoAgentStatePatch patch) {
        return new Terminal(status, patch);
    }

    @Getter
    @ToString(callSuper = true)
    public static final class Continue extends CoAgentNodeOutcome {
        private final String nextNode;

        private Continue(String nextNode, CoAgentStatePatch patch) {
            super(patch);
            this.nextNode = Objects.requireNonNull(nextNode, "nextNode");
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class Suspend extends CoAgentNodeOutcome {
        private final CoAgentApprovalRequest request;

        private Suspend(CoAgentApprovalRequest request, CoAgentStatePatch patch) {
            super(patch);
            this.request = Objects.requireNonNull(request, "request");
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class Terminal extends CoAgentNodeOutcome {
        private final CoAgentExecutionStatus status;

        private Terminal(CoAgentExecutionStatus status, CoAgentStatePatch patch) {
            super(patch);
            if (status == null || !status.isTerminal()) {
                throw new IllegalArgumentException("Terminal outcome requires a terminal status, got: " + status);
            }
            this.status = status;
        }
    }
}
