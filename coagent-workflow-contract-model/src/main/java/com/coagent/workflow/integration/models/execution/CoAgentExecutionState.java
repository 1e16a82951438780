package com.coagent.workflow.integration.models.execution;

import com.coagent.workflow.integration.constant.CoAgentConstants;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the state a workflow thread carries from node to node.
 *
 * <p>Workflow-specific fields live next to the control fields {@code current_node},
 * {@code steps_completed}, {@code errors} and {@code pending_approval}. Nodes read from it and
 * describe their changes as a {@link CoAgentStatePatch}; a new instance is produced for every
 * change, so a state handed to a node is never modified behind its back.</p>
 */
@ToString
@EqualsAndHashCode
public final class CoAgentExecutionState implements Serializable {

    private final Map<String, Object> values;

    private CoAgentExecutionState(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CoAgentExecutionState of(Map<String, Object> values) {
        return new CoAgentExecutionState(values == null ? Map.of() : values);
    }

    public static CoAgentExecutionState empty() {
        return new CoAgentExecutionState(Map.of());
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public double getNumber(String key, double defaultValue) {
        Object value = values.get(key);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    public String getCurrentNode() {
        return getString(CoAgentConstants.CURRENT_NODE);
    }

    @SuppressWarnings("unchecked")
    public List<String> getStepsCompleted() {
        Object steps = values.get(CoAgentConstants.STEPS_COMPLETED);
        if (steps instanceof List<?> list) {
            return Collections.unmodifiableList((List<String>) list);
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getErrors() {
        Object errors = values.get(CoAgentConstants.ERRORS);
        if (errors instanceof List<?> list) {
            return Collections.unmodifiableList((List<Map<String, Object>>) list);
        }
        return List.of();
    }

    public boolean isPendingApproval() {
        return getBoolean(CoAgentConstants.PENDING_APPROVAL);
    }

    /**
     * @return read-only view of every field
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * @return a mutable shallow copy, suitable as the base for serialization or a new state
     */
    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(values);
    }

    public CoAgentExecutionState apply(CoAgentStatePatch patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        Map<String, Object> next = toMap();
        next.putAll(patch.getPuts());
        patch.getAppends().forEach((key, items) -> {
            List<Object> merged = new ArrayList<>();
            Object existing = next.get(key);
            if (existing instanceof List<?> list) {
                merged.addAll(list);
            } else if (existing != null) {
                merged.add(existing);
            }
            merged.addAll(items);
            next.put(key, merged);
        });
        return new CoAgentExecutionState(next);
    }

    public CoAgentExecutionState withStepCompleted(String nodeName) {
        Map<String, Object> next = toMap();
        List<String> steps = new ArrayList<>(getStepsCompleted());
        steps.add(nodeName);
        next.put(CoAgentConstants.STEPS_COMPLETED, steps);
        return new CoAgentExecutionState(next);
    }

    public CoAgentExecutionState withCurrentNode(String nodeName) {
        Map<String, Object> next = toMap();
        next.put(CoAgentConstants.CURRENT_NODE, nodeName);
        return new CoAgentExecutionState(next);
    }
}
