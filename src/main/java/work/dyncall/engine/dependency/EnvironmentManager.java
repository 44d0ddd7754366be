package work.dyncall.engine.dependency;

/**
 * Materializes an isolated runtime environment per normalized manifest, cached by manifest identity.
 */
public interface EnvironmentManager {
    EnvironmentHandle ensureEnvironment(DependencyManifest manifest);

    String environmentId(DependencyManifest manifest);
}
