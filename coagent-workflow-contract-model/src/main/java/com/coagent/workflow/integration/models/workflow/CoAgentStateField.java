package com.coagent.workflow.integration.models.workflow;

import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

@Data
@Builder
@AllArgsConstructor
public class CoAgentStateField implements Serializable {
    private final String name;
    private final CoAgentFieldType type;
    private final boolean required;
    private final Object defaultValue;
    private final String description;
}
