package work.dyncall.engine.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.dyncall.engine.dependency.DependencyPolicy;
import work.dyncall.engine.dependency.EnvironmentManager;
import work.dyncall.engine.worker.WorkerLauncher;
import work.dyncall.engine.worker.WorkerSupervisor;

/**
 * Process-wide table of {@link RoleEnvironment}s, created on first use of a role.
 */
public final class RoleEnvironments implements AutoCloseable {
    private final EnvironmentManager manager;
    private final DependencyPolicy policy;
    private final WorkerLauncher launcher;
    private final int maxRestarts;
    private final Duration workerTimeout;
    private final Map<String, RoleEnvironment> roles = new ConcurrentHashMap<>();

    public RoleEnvironments(EnvironmentManager manager, DependencyPolicy policy, WorkerLauncher launcher,
                            int maxRestarts, Duration workerTimeout) {
        this.manager = manager;
        this.policy = policy;
        this.launcher = launcher;
        this.maxRestarts = maxRestarts;
        this.workerTimeout = workerTimeout;
    }

    public RoleEnvironment forRole(String role) {
        return roles.computeIfAbsent(role, name ->
            new RoleEnvironment(name, manager, policy, new WorkerSupervisor(launcher, maxRestarts, workerTimeout)));
    }

    @Override
    public void close() {
        List<RoleEnvironment> open = new ArrayList<>(roles.values());
        roles.clear();
        open.forEach(RoleEnvironment::close);
    }
}
