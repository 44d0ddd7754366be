package work.dyncall.engine.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps {@code (role, method)} to hand-written handlers. Anything not registered resolves to the
 * fallback handler, which synthesizes an implementation on demand.
 */
public final class DispatchTable {
    private final Map<String, Entry> handlers = new ConcurrentHashMap<>();
    private final MethodHandler fallback;

    public DispatchTable(MethodHandler fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public DispatchTable register(String role, String method, MethodHandler handler) {
        handlers.put(key(role, method), new Entry(role, method, Objects.requireNonNull(handler, "handler")));
        return this;
    }

    public DispatchTable registerAll(Map<String, Entry> entries) {
        if (entries != null) {
            entries.values().forEach(entry -> register(entry.role(), entry.method(), entry.handler()));
        }
        return this;
    }

    public void unregister(String role, String method) {
        handlers.remove(key(role, method));
    }

    public boolean handles(String role, String method) {
        return handlers.containsKey(key(role, method));
    }

    public MethodHandler resolve(String role, String method) {
        Entry entry = handlers.get(key(role, method));
        return entry == null ? fallback : entry.handler();
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    static String key(String role, String method) {
        return role + "#" + method;
    }

    public record Entry(String role, String method, MethodHandler handler) {}
}
