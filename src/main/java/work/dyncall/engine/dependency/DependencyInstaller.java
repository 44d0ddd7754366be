package work.dyncall.engine.dependency;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves and installs the libraries of a manifest into an environment's {@code lib} directory.
 */
public interface DependencyInstaller {
    /**
     * Locates an artifact for every dependency. Throws a {@code dependency_resolution_failed} error
     * when one cannot be found.
     */
    List<Path> resolve(DependencyManifest manifest);

    void install(List<Path> resolved, Path libDirectory) throws IOException;
}
