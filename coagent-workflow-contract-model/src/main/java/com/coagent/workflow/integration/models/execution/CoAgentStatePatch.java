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
import java.util.Set;

/**
 * Changes a node wants applied to the execution state.
 *
 * <p>A patch holds two kinds of operations: {@code put} replaces a field value, {@code append}
 * adds items to the end of a list field. Appends make it possible to extend append-only fields
 * such as {@code errors} without the node rebuilding the whole list.</p>
 *
 * <p>{@code steps_completed} and {@code current_node} are owned by the engine and cannot be patched.</p>
 */
@ToString
@EqualsAndHashCode
public final class CoAgentStatePatch implements Serializable {

    private static final CoAgentStatePatch EMPTY = new CoAgentStatePatch(Map.of(), Map.of());
    private static final Set<String> ENGINE_OWNED_FIELDS = Set.of(
            CoAgentConstants.STEPS_COMPLETED,
            CoAgentConstants.CURRENT_NODE);

    private final Map<String, Object> puts;
    private final Map<String, List<Object>> appends;

    private CoAgentStatePatch(Map<String, Object> puts, Map<String, List<Object>> appends) {
        this.puts = Collections.unmodifiableMap(new LinkedHashMap<>(puts));
        Map<String, List<Object>> appendsCopy = new LinkedHashMap<>();
        appends.forEach((key, items) -> appendsCopy.put(key, List.copyOf(items)));
        this.appends = Collections.unmodifiableMap(appendsCopy);
    }

    public static CoAgentStatePatch empty() {
        return EMPTY;
    }

    public static CoAgentStatePatch of(Map<String, Object> values) {
        return builder().putAll(values).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> getPuts() {
        return puts;
    }

    public Map<String, List<Object>> getAppends() {
        return appends;
    }

    public boolean isEmpty() {
        return puts.isEmpty() && appends.isEmpty();
    }

    /**
     * Combines two patches. Puts of {@code other} win, appends are concatenated in order.
     */
    public CoAgentStatePatch merge(CoAgentStatePatch other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        Builder builder = new Builder();
        builder.putAll(this.puts);
        this.appends.forEach((key, items) -> items.forEach(item -> builder.append(key, item)));
        builder.putAll(other.puts);
        other.appends.forEach((key, items) -> items.forEach(item -> builder.append(key, item)));
        return builder.build();
    }

    public static final class Builder {
        private final Map<String, Object> puts = new LinkedHashMap<>();
        private final Map<String, List<Object>> appends = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            checkNotEngineOwned(key);
            puts.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::put);
            }
            return this;
        }

        public Builder append(String key, Object item) {
            checkNotEngineOwned(key);
            appends.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
            return this;
        }

        public Builder appendError(String node, String message) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put(CoAgentConstants.ERROR_NODE, node);
            error.put(CoAgentConstants.ERROR_MESSAGE, message);
            return append(CoAgentConstants.ERRORS, error);
        }

        public CoAgentStatePatch build() {
            if (puts.isEmpty() && appends.isEmpty()) {
                return EMPTY;
            }
            return new CoAgentStatePatch(puts, appends);
        }

        private static void checkNotEngineOwned(String key) {
            if (ENGINE_OWNED_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Field [" + key + "] is maintained by the engine and cannot be patched");
            }
        }
    }
}
