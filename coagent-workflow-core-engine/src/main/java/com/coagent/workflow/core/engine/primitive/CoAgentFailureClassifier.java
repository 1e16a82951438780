package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.integration.enumerations.CoAgentFailureKind;
import com.coagent.workflow.integration.exception.CoAgentNodeRuntimeException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Decides whether another attempt of a failed operation can succeed.
 */
@FunctionalInterface
public interface CoAgentFailureClassifier extends Function<Throwable, CoAgentFailureKind> {

    /**
     * Node failures keep the kind they were raised with; timeouts and I/O errors are transient;
     * engine errors and anything else are fatal.
     */
    static CoAgentFailureClassifier defaults() {
        return error -> {
            if (error instanceof CoAgentNodeRuntimeException nodeFailure) {
                return nodeFailure.getFailureKind();
            }
            if (error instanceof CoAgentWorkflowException) {
                return CoAgentFailureKind.FATAL;
            }
            if (error instanceof TimeoutException || error instanceof IOException) {
                return CoAgentFailureKind.TRANSIENT;
            }
            return CoAgentFailureKind.FATAL;
        };
    }

    static CoAgentFailureClassifier retryAll() {
        return error -> error instanceof CoAgentWorkflowException ? CoAgentFailureKind.FATAL : CoAgentFailureKind.TRANSIENT;
    }
}
