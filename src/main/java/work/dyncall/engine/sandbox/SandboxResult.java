package work.dyncall.engine.sandbox;

import java.util.List;
import java.util.Map;

/**
 * Raw return value of a program plus the memory it left behind.
 */
public record SandboxResult(Object value, Map<String, Object> context, List<String> messages) {
    public SandboxResult {
        context = context == null ? Map.of() : context;
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
