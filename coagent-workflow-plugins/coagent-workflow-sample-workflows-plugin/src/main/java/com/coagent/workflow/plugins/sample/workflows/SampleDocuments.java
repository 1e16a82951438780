package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.integration.enumerations.CoAgentFailureKind;
import com.coagent.workflow.integration.exception.CoAgentNodeRuntimeException;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers shared by the sample workflows.
 */
final class SampleDocuments {

    private SampleDocuments() {
    }

    /**
     * @return the generated name of a record returned by the document client
     */
    static String nameOf(Map<String, Object> record) {
        Object name = record.get("name");
        if (name == null) {
            throw new CoAgentNodeRuntimeException("Document client returned a record without a name: " + record, CoAgentFailureKind.FATAL);
        }
        return name.toString();
    }

    /**
     * @return the listed fields present in the state, in the given order
     */
    static Map<String, Object> pick(CoAgentExecutionState state, String... fields) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : fields) {
            if (state.contains(field)) {
                values.put(field, state.get(field));
            }
        }
        return values;
    }

    static LocalDate parseDate(String field, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new CoAgentNodeRuntimeException(field + " is not an ISO date: " + value, CoAgentFailureKind.FATAL, e);
        }
    }

    static double round(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
