package work.dyncall.engine.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import work.dyncall.engine.dependency.EnvironmentHandle;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.sandbox.ExecutionSandbox;

/**
 * Worker launcher for tests: each "worker" answers requests through {@link WorkerMain#handle} in the
 * current JVM, so the wire format is exercised without spawning processes.
 */
public final class InProcessWorkerLauncher implements WorkerLauncher {
    private final AtomicLong pids = new AtomicLong(40_000);
    private final List<Worker> launched = Collections.synchronizedList(new ArrayList<>());

    @Override
    public WorkerExecutor launch(EnvironmentHandle environment) {
        Worker worker = new Worker(pids.incrementAndGet(), environment.envId());
        launched.add(worker);
        return worker;
    }

    public List<Worker> launched() {
        return List.copyOf(launched);
    }

    public int launchCount() {
        return launched.size();
    }

    public static final class Worker implements WorkerExecutor {
        private final long pid;
        private final String envId;
        private final ExecutionSandbox sandbox = new ExecutionSandbox(Duration.ZERO);
        private volatile boolean alive = true;
        private int handled;

        Worker(long pid, String envId) {
            this.pid = pid;
            this.envId = envId;
        }

        public String envId() {
            return envId;
        }

        public synchronized int handled() {
            return handled;
        }

        @Override
        public long pid() {
            return pid;
        }

        @Override
        public boolean alive() {
            return alive;
        }

        @Override
        public synchronized WorkerResponse execute(WorkerRequest request, Duration timeout) {
            if (!alive) {
                throw new DynamicCallException(ErrorType.WORKER_CRASH, "worker " + pid + " is not running");
            }
            handled++;
            try {
                String response = WorkerProtocol.encode(WorkerMain.handle(sandbox, WorkerProtocol.encode(request), pid));
                return WorkerProtocol.decodeResponse(response);
            } catch (JsonProcessingException ex) {
                throw new DynamicCallException(ErrorType.WORKER_CRASH, "unreadable worker message: " + ex.getOriginalMessage(), ex);
            }
        }

        @Override
        public void shutdown() {
            alive = false;
        }
    }
}
