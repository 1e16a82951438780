package com.coagent.workflow.integration.models.workflow;

import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared fields of a workflow's initial state, in declaration order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CoAgentStateSchema implements Serializable {

    private final List<CoAgentStateField> fields;

    private CoAgentStateSchema(List<CoAgentStateField> fields) {
        this.fields = List.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CoAgentStateSchema empty() {
        return new CoAgentStateSchema(List.of());
    }

    public Optional<CoAgentStateField> getField(String name) {
        return fields.stream().filter(field -> field.getName().equals(name)).findFirst();
    }

    /**
     * @return field name to {type, required, default, description}, the shape published by the registry
     */
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        for (CoAgentStateField field : fields) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", field.getType().getValue());
            entry.put("required", field.isRequired());
            if (field.getDefaultValue() != null) {
                entry.put("default", field.getDefaultValue());
            }
            if (field.getDescription() != null) {
                entry.put("description", field.getDescription());
            }
            description.put(field.getName(), entry);
        }
        return description;
    }

    public static final class Builder {
        private final List<CoAgentStateField> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder required(String name, CoAgentFieldType type, String description) {
            fields.add(new CoAgentStateField(name, type, true, null, description));
            return this;
        }

        public Builder optional(String name, CoAgentFieldType type, Object defaultValue, String description) {
            fields.add(new CoAgentStateField(name, type, false, defaultValue, description));
            return this;
        }

        public CoAgentStateSchema build() {
            long distinct = fields.stream().map(CoAgentStateField::getName).distinct().count();
            if (distinct != fields.size()) {
                throw new IllegalStateException("State schema declares a field more than once: " + fields);
            }
            return new CoAgentStateSchema(fields);
        }
    }
}
