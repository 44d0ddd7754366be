package work.dyncall.engine.sandbox;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;

/**
 * The {@code api} object handed to programs. The sandbox runs with explicit host access, so only the
 * exported members are reachable from script code.
 */
public final class SandboxBridge {
    private static final Logger log = LoggerFactory.getLogger(SandboxBridge.class);

    private final Context jsContext;
    private final Value memory;
    private final SandboxCapabilities capabilities;
    private final String role;
    private final String method;
    private final List<String> messages;

    SandboxBridge(Context jsContext, Value memory, SandboxCapabilities capabilities, String role, String method, List<String> messages) {
        this.jsContext = jsContext;
        this.memory = memory;
        this.capabilities = capabilities;
        this.role = role;
        this.method = method;
        this.messages = messages;
    }

    @HostAccess.Export
    public DelegateHandle delegate(String targetRole) {
        return delegate(targetRole, null);
    }

    @HostAccess.Export
    public DelegateHandle delegate(String targetRole, Object options) {
        if (targetRole == null || targetRole.isBlank()) {
            throw new IllegalArgumentException("delegate requires a role name");
        }
        return new DelegateHandle(targetRole.trim(), PolyglotValues.toJavaMap(options));
    }

    @HostAccess.Export
    public DelegateHandle tool(String name) {
        if (name == null || !capabilities.hasTool(name.trim())) {
            throw new IllegalArgumentException("Unknown tool: " + name);
        }
        return new DelegateHandle(name.trim(), Map.of());
    }

    @HostAccess.Export
    public void remember(String key, Object value) {
        memory.putMember(key, PolyglotValues.toJsValue(jsContext, PolyglotValues.toJava(value)));
    }

    @HostAccess.Export
    public Object recall(String key) {
        return memory.hasMember(key) ? memory.getMember(key) : null;
    }

    @HostAccess.Export
    public Outcome ok(Object value) {
        return Outcome.ok(PolyglotValues.toJava(value), role, method);
    }

    @HostAccess.Export
    public Outcome error(String type, String message) {
        return error(type, message, false);
    }

    @HostAccess.Export
    public Outcome error(String type, String message, boolean retriable) {
        return Outcome.error(type, message, retriable, role, method);
    }

    @HostAccess.Export
    public void log(Object... values) {
        List<String> parts = new ArrayList<>();
        for (Object value : values) {
            Object converted = PolyglotValues.toJava(value);
            parts.add(converted == null ? "null" : String.valueOf(converted));
        }
        String rendered = String.join(" ", parts);
        messages.add(rendered);
        log.debug("[{}.{}] {}", role, method, rendered);
    }

    /**
     * Handle on a delegated role; {@code call} runs a nested invocation and returns its outcome as a plain object.
     */
    public final class DelegateHandle implements ExecutableReference {
        private final String targetRole;
        private final Map<String, Object> options;

        DelegateHandle(String targetRole, Map<String, Object> options) {
            this.targetRole = targetRole;
            this.options = options;
        }

        @HostAccess.Export
        public String role() {
            return targetRole;
        }

        @HostAccess.Export
        public Value call(String targetMethod) {
            return call(targetMethod, null, null);
        }

        @HostAccess.Export
        public Value call(String targetMethod, Object args) {
            return call(targetMethod, args, null);
        }

        @HostAccess.Export
        public Value call(String targetMethod, Object args, Object kwargs) {
            List<Object> callArgs = args == null ? List.of() : PolyglotValues.toJavaList(args);
            Map<String, Object> callKwargs = kwargs == null ? Map.of() : PolyglotValues.toJavaMap(kwargs);
            Outcome outcome = capabilities.delegate(targetRole, options, targetMethod, callArgs, callKwargs);
            return PolyglotValues.toJsValue(jsContext, new LinkedHashMap<>(outcome.toMap()));
        }

        @Override
        public String describe() {
            return "delegate:" + targetRole;
        }
    }
}
