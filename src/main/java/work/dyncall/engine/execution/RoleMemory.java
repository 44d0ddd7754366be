package work.dyncall.engine.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.dyncall.engine.runtime.JsonValues;

/**
 * The memory a role's programs see as {@code context}. Programs work on copies; the result of a
 * finished attempt replaces the whole map.
 */
public final class RoleMemory {
    public static final String TOOLS_KEY = "tools";

    private Map<String, Object> state;

    public RoleMemory() {
        this(Map.of());
    }

    public RoleMemory(Map<String, Object> initial) {
        this.state = JsonValues.deepCloneMap(initial);
    }

    public synchronized Map<String, Object> view() {
        return Collections.unmodifiableMap(state);
    }

    public synchronized Map<String, Object> copy() {
        return JsonValues.deepCloneMap(state);
    }

    public synchronized Object get(String key) {
        return state.get(key);
    }

    public synchronized void put(String key, Object value) {
        state.put(key, JsonValues.deepClone(value));
    }

    public synchronized void replace(Map<String, Object> next) {
        state = JsonValues.deepCloneMap(next);
    }

    /** Adds registry tools this memory does not know yet; entries already in memory win. */
    public synchronized void mergeTools(Map<String, Object> registryTools) {
        if (registryTools == null || registryTools.isEmpty()) {
            return;
        }
        Map<String, Object> merged = new LinkedHashMap<>(JsonValues.deepCloneMap(registryTools));
        if (state.get(TOOLS_KEY) instanceof Map<?, ?> current) {
            merged.putAll(JsonValues.deepCloneMap(current));
        }
        state.put(TOOLS_KEY, merged);
    }
}
