package work.dyncall.engine.worker;

import java.time.Duration;

/**
 * A single live worker. {@link #execute} throws a {@code timeout} or {@code worker_crash}
 * {@link work.dyncall.engine.failure.DynamicCallException} when the worker misbehaves.
 */
public interface WorkerExecutor {
    long pid();

    boolean alive();

    WorkerResponse execute(WorkerRequest request, Duration timeout);

    void shutdown();
}
