package work.dyncall.engine.execution;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.dependency.EnvironmentHandle;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.generation.GeneratedProgram;
import work.dyncall.engine.runtime.CallFrame;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.sandbox.ExecutionSandbox;
import work.dyncall.engine.sandbox.SandboxRequest;
import work.dyncall.engine.sandbox.SandboxResult;
import work.dyncall.engine.worker.WorkerProtocol;
import work.dyncall.engine.worker.WorkerRequest;
import work.dyncall.engine.worker.WorkerResponse;

/**
 * Runs one program and coerces its raw result into an {@link Outcome}. Programs without dependencies
 * run in the in-process sandbox; the rest go to the role's worker.
 */
public final class ProgramRunner {
    private static final Logger log = LoggerFactory.getLogger(ProgramRunner.class);

    private final ExecutionSandbox sandbox;
    private final RoleEnvironments environments;

    public ProgramRunner(ExecutionSandbox sandbox, RoleEnvironments environments) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.environments = Objects.requireNonNull(environments, "environments");
    }

    Outcome run(CallScope scope, CallState state, GeneratedProgram program) {
        if (log.isDebugEnabled()) {
            log.debug("[{}.{}] program ({}):\n{}", scope.role(), scope.method(), program.origin().wireName(), program.code());
        }
        RoleEnvironment roleEnvironment = environments.forRole(scope.role());
        Optional<EnvironmentHandle> environment = roleEnvironment.prepare(program.manifest());
        state.capture(environment.orElse(null));
        if (environment.isPresent()) {
            return runInWorker(scope, state, program, roleEnvironment, environment.get());
        }
        Invocation invocation = scope.invocation();
        SandboxResult result = sandbox.execute(
            new SandboxRequest(scope.role(), scope.method(), program.code(), invocation.args(), invocation.kwargs(),
                scope.memory().copy(), callInfo(invocation)),
            scope.capabilities());
        scope.memory().replace(result.context());
        return Outcome.coerce(result.value(), scope.role(), scope.method());
    }

    private Outcome runInWorker(CallScope scope, CallState state, GeneratedProgram program,
                                RoleEnvironment roleEnvironment, EnvironmentHandle environment) {
        Invocation invocation = scope.invocation();
        Map<String, Object> context = scope.memory().copy();
        requirePlainData(invocation.args(), "args");
        requirePlainData(invocation.kwargs(), "kwargs");
        requirePlainData(context, "context");
        WorkerRequest request = new WorkerRequest(WorkerProtocol.IPC_VERSION, invocation.frame().callId(), scope.role(),
            scope.method(), program.code(), invocation.args(), invocation.kwargs(), context);
        WorkerResponse response = roleEnvironment.supervisor().execute(environment, request);
        state.workerPid = response.workerPid();
        state.workerRestartCount = response.workerRestartCount();
        if (response.isOk()) {
            scope.memory().replace(response.contextSnapshot() == null ? Map.of() : response.contextSnapshot());
            return Outcome.coerce(response.value(), scope.role(), scope.method());
        }
        throw workerError(scope, response);
    }

    private static DynamicCallException workerError(CallScope scope, WorkerResponse response) {
        String message = response.errorMessage() == null ? "" : response.errorMessage();
        ErrorType type = ErrorType.fromWireName(response.errorType());
        return switch (type) {
            case NON_SERIALIZABLE_RESULT -> new DynamicCallException(type, message);
            case TIMEOUT, WORKER_CRASH -> new DynamicCallException(type, message,
                response.retriable() == null ? type.retriable() : response.retriable(), Map.of(), null);
            default -> new DynamicCallException(ErrorType.EXECUTION, "Worker execution error in " + scope.role() + ": " + message);
        };
    }

    private static void requirePlainData(Object value, String field) {
        if (!JsonValues.isPlainData(value)) {
            throw new DynamicCallException(ErrorType.NON_SERIALIZABLE_RESULT, field + " contains non-JSON-compatible values");
        }
    }

    private static Map<String, Object> callInfo(Invocation invocation) {
        CallFrame frame = invocation.frame();
        Map<String, Object> info = new LinkedHashMap<>(frame.toMap());
        info.put("role", invocation.role());
        info.put("method", invocation.method());
        return info;
    }
}
