package work.dyncall.engine.execution;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.dependency.DependencyManifest;
import work.dyncall.engine.dependency.DependencyPolicy;
import work.dyncall.engine.dependency.EnvironmentHandle;
import work.dyncall.engine.dependency.EnvironmentManager;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.worker.WorkerSupervisor;

/**
 * Dependency state of one role: the manifest accumulated so far and the supervisor of its worker.
 * A later manifest may only add dependencies; changing or dropping one is rejected before the worker
 * is touched.
 */
public final class RoleEnvironment implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RoleEnvironment.class);

    private final String role;
    private final EnvironmentManager manager;
    private final DependencyPolicy policy;
    private final WorkerSupervisor supervisor;

    private DependencyManifest manifest;

    RoleEnvironment(String role, EnvironmentManager manager, DependencyPolicy policy, WorkerSupervisor supervisor) {
        this.role = Objects.requireNonNull(role, "role");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.policy = policy == null ? DependencyPolicy.permissive() : policy;
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    /**
     * Materializes the environment for a program's manifest. Empty when the program declares nothing,
     * in which case it runs in process.
     */
    public synchronized Optional<EnvironmentHandle> prepare(DependencyManifest incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return Optional.empty();
        }
        if (manifest != null && !manifest.isSatisfiedAdditivelyBy(incoming)) {
            throw new DynamicCallException(ErrorType.DEPENDENCY_MANIFEST_INCOMPATIBLE,
                "dependencies for " + role + " are incompatible with prior manifest "
                    + "(existing dependencies must remain with identical versions)");
        }
        policy.enforce(incoming);
        if (!incoming.equals(manifest)) {
            log.debug("Manifest for {} is now {}", role, incoming);
        }
        manifest = incoming;
        return Optional.of(manager.ensureEnvironment(incoming));
    }

    public synchronized DependencyManifest manifest() {
        return manifest == null ? DependencyManifest.empty() : manifest;
    }

    public WorkerSupervisor supervisor() {
        return supervisor;
    }

    @Override
    public void close() {
        supervisor.shutdown();
    }
}
