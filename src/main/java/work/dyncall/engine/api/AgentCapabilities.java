package work.dyncall.engine.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.sandbox.SandboxCapabilities;

/**
 * What a program running for one invocation may reach: delegated agents one level deeper, and the
 * tools in the registry.
 */
final class AgentCapabilities implements SandboxCapabilities {
    private static final Logger log = LoggerFactory.getLogger(AgentCapabilities.class);

    private final DynamicCallEngine engine;
    private final Invocation caller;

    AgentCapabilities(DynamicCallEngine engine, Invocation caller) {
        this.engine = engine;
        this.caller = caller;
    }

    @Override
    public Outcome delegate(String role, Map<String, Object> options, String method, List<Object> args, Map<String, Object> kwargs) {
        int depth = caller.frame().depth() + 1;
        if (depth > engine.maxDelegationDepth()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("depth", depth);
            metadata.put("max_delegation_depth", engine.maxDelegationDepth());
            return Outcome.error(ErrorType.BUDGET_EXCEEDED.wireName(),
                "Delegation budget exceeded in " + caller.role() + ".delegate (depth " + depth + " > "
                    + engine.maxDelegationDepth() + ")",
                false, metadata, role, method);
        }
        AgentOptions delegateOptions;
        try {
            delegateOptions = AgentOptions.fromDelegateOptions(role, options);
        } catch (IllegalArgumentException ex) {
            return Outcome.error("invalid_delegate_options", ex.getMessage(), false, role, method);
        }
        if (delegateOptions.purpose() != null) {
            register(role, method, delegateOptions);
        }
        return engine.delegatedAgent(role, delegateOptions, caller.frame()).call(method, args, kwargs);
    }

    @Override
    public boolean hasTool(String name) {
        try {
            return engine.registry().loadTools().containsKey(name);
        } catch (IOException ex) {
            log.warn("Unable to read tool registry {}: {}", engine.registry().path(), ex.getMessage());
            return false;
        }
    }

    private void register(String role, String method, AgentOptions options) {
        Map<String, Object> deliverable = options.contract() == null ? null : options.contract().raw();
        try {
            engine.registry().register(role, options.purpose(), List.of(method), deliverable);
        } catch (IOException ex) {
            log.warn("Unable to register tool {} in {}: {}", role, engine.registry().path(), ex.getMessage());
        }
    }
}
