package work.dyncall.engine.api;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.execution.CallScope;
import work.dyncall.engine.execution.RoleMemory;
import work.dyncall.engine.runtime.CallFrame;
import work.dyncall.engine.runtime.Invocation;

/**
 * Handle on one role. Any method can be called on it; unknown methods are synthesized on first use.
 * The agent's memory is shared by every call made through this handle.
 */
public final class Agent {
    private static final Logger log = LoggerFactory.getLogger(Agent.class);

    private final DynamicCallEngine engine;
    private final String role;
    private final AgentOptions options;
    private final CallFrame parent;
    private final RoleMemory memory = new RoleMemory();

    Agent(DynamicCallEngine engine, String role, AgentOptions options, CallFrame parent) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        this.engine = Objects.requireNonNull(engine, "engine");
        this.role = role.trim();
        this.options = options == null ? AgentOptions.none() : options;
        this.parent = parent;
        hydrateTools();
    }

    public String role() {
        return role;
    }

    public AgentOptions options() {
        return options;
    }

    /** Depth of calls made through this handle; 0 for agents created by the engine directly. */
    public int depth() {
        return parent == null ? 0 : parent.depth() + 1;
    }

    /** Live view of the role's memory. */
    public Map<String, Object> memory() {
        return memory.view();
    }

    public Outcome call(String method) {
        return call(method, List.of(), Map.of());
    }

    public Outcome call(String method, List<Object> args) {
        return call(method, args, Map.of());
    }

    /**
     * Runs {@code role.method}. Never throws: every failure comes back as an error outcome.
     */
    public Outcome call(String method, List<Object> args, Map<String, Object> kwargs) {
        if (method == null || method.isBlank()) {
            return Outcome.error("invalid_method", "method must not be blank", false, role, method);
        }
        CallFrame frame = parent == null ? CallFrame.root() : parent.child();
        Invocation invocation = new Invocation(role, method.trim(), args, kwargs, frame);
        CallScope scope = new CallScope(invocation, memory, options.contract(), options.purpose(), options.profile(),
            new AgentCapabilities(engine, invocation));
        try {
            return engine.dispatch(scope);
        } catch (Exception ex) {
            log.debug("Handler for {}.{} failed", role, method, ex);
            return Outcome.fromException(ex, role, method);
        }
    }

    private void hydrateTools() {
        try {
            memory.mergeTools(engine.registry().loadTools());
        } catch (IOException ex) {
            log.warn("Unable to read tool registry {}: {}", engine.registry().path(), ex.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Agent[" + role + "]";
    }
}
