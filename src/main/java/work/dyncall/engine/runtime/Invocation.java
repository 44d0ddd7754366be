package work.dyncall.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One logical call: who, what, with which arguments, and where in the call tree. Arguments may hold
 * JSON nulls.
 */
public record Invocation(String role, String method, List<Object> args, Map<String, Object> kwargs, CallFrame frame) {
    public Invocation {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }
}
