package work.dyncall.engine.api;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.artifact.ArtifactRecorder;
import work.dyncall.engine.artifact.ArtifactSelector;
import work.dyncall.engine.artifact.ArtifactStore;
import work.dyncall.engine.artifact.PromotionLifecycle;
import work.dyncall.engine.dependency.DirectoryEnvironmentManager;
import work.dyncall.engine.dependency.LocalRepositoryInstaller;
import work.dyncall.engine.execution.AttemptLifecycleController;
import work.dyncall.engine.execution.CallScope;
import work.dyncall.engine.execution.ProgramRunner;
import work.dyncall.engine.execution.RoleEnvironments;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.generation.ProgramGenerator;
import work.dyncall.engine.guardrail.ContinuityGuard;
import work.dyncall.engine.guardrail.GuardrailPolicy;
import work.dyncall.engine.registry.PatternMemoryStore;
import work.dyncall.engine.registry.ToolRegistryStore;
import work.dyncall.engine.runtime.CallFrame;
import work.dyncall.engine.runtime.DispatchTable;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.runtime.MethodHandler;
import work.dyncall.engine.sandbox.ExecutionSandbox;
import work.dyncall.engine.worker.JavaWorkerLauncher;

/**
 * Public entry point for embedding the engine. Owns the process-wide stores and role environments;
 * hands out {@link Agent}s that route calls through the dispatch table.
 */
public final class DynamicCallEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DynamicCallEngine.class);

    private final EngineConfiguration configuration;
    private final ToolRegistryStore registry;
    private final PatternMemoryStore patterns;
    private final ArtifactStore artifacts;
    private final RoleEnvironments environments;
    private final AttemptLifecycleController controller;
    private final DispatchTable dispatch;
    private final Map<String, CallScope> inFlight = new ConcurrentHashMap<>();

    public DynamicCallEngine(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.registry = new ToolRegistryStore(configuration.toolstoreRoot());
        this.patterns = new PatternMemoryStore(configuration.toolstoreRoot());
        this.artifacts = new ArtifactStore(configuration.toolstoreRoot());
        this.environments = new RoleEnvironments(
            new DirectoryEnvironmentManager(configuration.environmentRoot(),
                new LocalRepositoryInstaller(configuration.dependencySources()), configuration.dependencyPolicy()),
            configuration.dependencyPolicy(),
            configuration.workerLauncher() == null ? new JavaWorkerLauncher() : configuration.workerLauncher(),
            configuration.workerMaxRestarts(),
            configuration.workerTimeout()
        );
        this.controller = new AttemptLifecycleController(
            new ProgramGenerator(configuration.generator(), configuration.model(),
                configuration.maxGenerationAttempts(), configuration.generationTimeout()),
            new ArtifactSelector(artifacts, configuration.promotionEnforced()),
            new ArtifactRecorder(artifacts, new PromotionLifecycle(configuration.promotionPolicy(),
                configuration.promotionShadowMode(), configuration.promotionEnforced())),
            registry,
            patterns,
            GuardrailPolicy.defaults(),
            new ContinuityGuard(configuration.continuityEnforced(), this::recordedPrimaryKey),
            new ProgramRunner(new ExecutionSandbox(configuration.sandboxTimeout()), environments),
            configuration.budgets(),
            configuration.sinks()
        );
        this.dispatch = new DispatchTable(this::synthesize);
        log.debug("Engine ready with toolstore {}", configuration.toolstoreRoot());
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public ToolRegistryStore registry() {
        return registry;
    }

    public PatternMemoryStore patterns() {
        return patterns;
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public Agent agent(String role) {
        return agent(role, AgentOptions.none());
    }

    public Agent agent(String role, AgentOptions options) {
        return new Agent(this, role, options, null);
    }

    /** Routes {@code role.method} to a hand-written handler instead of generated code. */
    public DynamicCallEngine registerHandler(String role, String method, MethodHandler handler) {
        dispatch.register(role, method, handler);
        return this;
    }

    Agent delegatedAgent(String role, AgentOptions options, CallFrame parent) {
        return new Agent(this, role, options, parent);
    }

    Outcome dispatch(CallScope scope) throws Exception {
        Invocation invocation = scope.invocation();
        MethodHandler handler = dispatch.resolve(invocation.role(), invocation.method());
        String callId = invocation.frame().callId();
        inFlight.put(callId, scope);
        try {
            return Outcome.coerce(handler.invoke(invocation), invocation.role(), invocation.method());
        } finally {
            inFlight.remove(callId);
        }
    }

    int maxDelegationDepth() {
        return configuration.maxDelegationDepth();
    }

    private Outcome synthesize(Invocation invocation) {
        CallScope scope = inFlight.get(invocation.frame().callId());
        if (scope == null) {
            throw new DynamicCallException(ErrorType.EXECUTION,
                "No active call for " + invocation.role() + "." + invocation.method());
        }
        return controller.execute(scope);
    }

    private Optional<String> recordedPrimaryKey(String role, String method) {
        try {
            Object tool = registry.loadTools().get(role);
            if (!(tool instanceof Map<?, ?> entry) || !(entry.get("method_state_keys") instanceof Map<?, ?> profiles)) {
                return Optional.empty();
            }
            Object keys = profiles.get(method);
            if (keys instanceof List<?> list && !list.isEmpty()) {
                return Optional.ofNullable(JsonValues.optionalString(list.get(0)));
            }
            return Optional.empty();
        } catch (IOException ex) {
            log.warn("Unable to read recorded state keys for {}.{}: {}", role, method, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        environments.close();
    }
}
