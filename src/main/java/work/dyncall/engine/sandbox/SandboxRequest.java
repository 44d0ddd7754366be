package work.dyncall.engine.sandbox;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one sandboxed attempt. {@code context} is the attempt-local copy of the role's memory.
 */
public record SandboxRequest(
    String role,
    String method,
    String code,
    List<Object> args,
    Map<String, Object> kwargs,
    Map<String, Object> context,
    Map<String, Object> callInfo
) {
    public SandboxRequest {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(code, "code");
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
        context = context == null ? Map.of() : context;
        callInfo = callInfo == null ? Map.of() : callInfo;
    }
}
