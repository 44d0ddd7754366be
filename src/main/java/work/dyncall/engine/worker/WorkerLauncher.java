package work.dyncall.engine.worker;

import java.io.IOException;
import work.dyncall.engine.dependency.EnvironmentHandle;

@FunctionalInterface
public interface WorkerLauncher {
    WorkerExecutor launch(EnvironmentHandle environment) throws IOException;
}
