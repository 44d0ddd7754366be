package work.dyncall.engine.worker;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.dependency.EnvironmentHandle;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Keeps one worker alive per environment id. A changed environment replaces the worker gracefully; a
 * timeout or crash restarts it until {@code maxRestarts} consecutive failures have been spent, after
 * which the supervisor answers with a terminal {@code worker_crash} until the environment changes.
 */
public final class WorkerSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final WorkerLauncher launcher;
    private final int maxRestarts;
    private final Duration timeout;

    private WorkerExecutor executor;
    private String envId;
    private int restartCount;
    private int consecutiveFailures;
    private boolean exhausted;

    public WorkerSupervisor(WorkerLauncher launcher, int maxRestarts, Duration timeout) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0");
        }
        this.maxRestarts = maxRestarts;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public synchronized WorkerResponse execute(EnvironmentHandle environment, WorkerRequest request) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(request, "request");
        if (!environment.envId().equals(envId)) {
            switchEnvironment(environment);
        } else if (exhausted) {
            return failure(ErrorType.WORKER_CRASH, "worker restart budget exhausted for env " + envId, null, false);
        }

        WorkerExecutor current;
        try {
            current = ensureExecutor(environment);
        } catch (IOException ex) {
            return handleFailure(environment, ErrorType.WORKER_CRASH, "failed to start worker: " + ex.getMessage(), null);
        }
        try {
            WorkerResponse response = current.execute(request, timeout);
            consecutiveFailures = 0;
            return response.supervised(current.pid(), restartCount, null);
        } catch (DynamicCallException ex) {
            ErrorType type = ex.type() == ErrorType.TIMEOUT ? ErrorType.TIMEOUT : ErrorType.WORKER_CRASH;
            return handleFailure(environment, type, ex.getMessage(), current.pid());
        }
    }

    public synchronized int restartCount() {
        return restartCount;
    }

    public synchronized Long workerPid() {
        return executor == null ? null : executor.pid();
    }

    public synchronized String envId() {
        return envId;
    }

    public synchronized void shutdown() {
        stopExecutor();
        envId = null;
    }

    @Override
    public void close() {
        shutdown();
    }

    private void switchEnvironment(EnvironmentHandle environment) {
        if (executor != null) {
            log.info("Environment changed {} -> {}, replacing worker {}", envId, environment.envId(), executor.pid());
        }
        stopExecutor();
        envId = environment.envId();
        consecutiveFailures = 0;
        exhausted = false;
    }

    private WorkerExecutor ensureExecutor(EnvironmentHandle environment) throws IOException {
        if (executor != null && executor.alive()) {
            return executor;
        }
        stopExecutor();
        executor = launcher.launch(environment);
        return executor;
    }

    private WorkerResponse handleFailure(EnvironmentHandle environment, ErrorType type, String message, Long pid) {
        stopExecutor();
        consecutiveFailures++;
        if (consecutiveFailures > maxRestarts) {
            exhausted = true;
            log.warn("Worker for env {} failed {} times in a row ({}); giving up", envId, consecutiveFailures, type.wireName());
            return failure(type, message, pid, false);
        }
        restartCount++;
        log.warn("Worker for env {} failed ({}): {}; restart {}/{}", envId, type.wireName(), message, consecutiveFailures, maxRestarts);
        try {
            executor = launcher.launch(environment);
        } catch (IOException ex) {
            log.warn("Restarting worker for env {} failed: {}", envId, ex.getMessage());
        }
        return failure(type, message, pid, true);
    }

    private WorkerResponse failure(ErrorType type, String message, Long pid, boolean retriable) {
        WorkerResponse response = new WorkerResponse(WorkerProtocol.IPC_VERSION, null, WorkerResponse.STATUS_ERROR, null, null,
            type.wireName(), message, pid, null, null);
        return response.supervised(pid, restartCount, retriable);
    }

    private void stopExecutor() {
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }
}
