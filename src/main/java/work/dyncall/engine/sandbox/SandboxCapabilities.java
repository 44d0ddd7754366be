package work.dyncall.engine.sandbox;

import java.util.List;
import java.util.Map;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Host capabilities a program may reach through {@code api.delegate} and {@code api.tool}.
 */
public interface SandboxCapabilities {
    /**
     * Runs a nested invocation synchronously and returns its outcome.
     */
    Outcome delegate(String role, Map<String, Object> options, String method, List<Object> args, Map<String, Object> kwargs);

    boolean hasTool(String name);

    /** Capability set for worker processes, where delegation is not available. */
    static SandboxCapabilities none() {
        return new SandboxCapabilities() {
            @Override
            public Outcome delegate(String role, Map<String, Object> options, String method, List<Object> args, Map<String, Object> kwargs) {
                throw new DynamicCallException(ErrorType.EXECUTION, "delegation is not available in isolated workers");
            }

            @Override
            public boolean hasTool(String name) {
                return false;
            }
        };
    }
}
