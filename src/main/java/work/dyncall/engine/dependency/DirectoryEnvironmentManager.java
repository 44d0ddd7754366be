package work.dyncall.engine.dependency;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;

/**
 * Default environment manager: one directory per environment id holding {@code manifest.json},
 * the installed {@code lib/} jars and a {@code .ready} marker.
 */
public final class DirectoryEnvironmentManager implements EnvironmentManager {
    private static final Logger log = LoggerFactory.getLogger(DirectoryEnvironmentManager.class);
    private static final String READY_MARKER = ".ready";
    private static final String MANIFEST_FILE = "manifest.json";

    private final Path root;
    private final DependencyInstaller installer;
    private final DependencyPolicy.SourceMode sourceMode;
    private final List<String> sources;

    public DirectoryEnvironmentManager(Path root, DependencyInstaller installer, DependencyPolicy policy) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.installer = Objects.requireNonNull(installer, "installer");
        this.sourceMode = policy == null ? DependencyPolicy.SourceMode.PUBLIC : policy.sourceMode();
        this.sources = policy == null ? List.of() : policy.sources();
    }

    @Override
    public String environmentId(DependencyManifest manifest) {
        String runtime = "java:" + System.getProperty("java.specification.version")
            + "|os:" + System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT)
            + "|arch:" + System.getProperty("os.arch", "unknown");
        String fingerprint = runtime
            + "|source_mode:" + sourceMode.wireName()
            + "|sources:" + JsonValues.toJson(sources)
            + "|deps:" + manifest.toJson();
        return Hashing.sha256Hex(fingerprint);
    }

    @Override
    public synchronized EnvironmentHandle ensureEnvironment(DependencyManifest manifest) {
        long started = System.nanoTime();
        String envId = environmentId(manifest);
        Path envDir = root.resolve(envId);
        String manifestJson = manifest.toJson();

        if (isReady(envDir, manifestJson)) {
            return new EnvironmentHandle(envId, envDir, manifest, true, elapsedMs(started), 0.0, 0.0);
        }

        long resolveStarted = System.nanoTime();
        List<Path> resolved = installer.resolve(manifest);
        double resolveMs = elapsedMs(resolveStarted);

        long installStarted = System.nanoTime();
        try {
            Files.createDirectories(envDir);
            installer.install(resolved, envDir.resolve("lib"));
            Files.writeString(envDir.resolve(MANIFEST_FILE), manifestJson, StandardCharsets.UTF_8);
            Files.writeString(envDir.resolve(READY_MARKER), envId, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DynamicCallException(ErrorType.DEPENDENCY_INSTALL_FAILED,
                "failed to materialize environment " + envId + ": " + ex.getMessage(), ex);
        }
        double installMs = elapsedMs(installStarted);
        log.debug("Materialized environment {} ({} dependencies) in {}", envId, manifest.dependencies().size(), envDir);
        return new EnvironmentHandle(envId, envDir, manifest, false, elapsedMs(started), resolveMs, installMs);
    }

    private static boolean isReady(Path envDir, String manifestJson) {
        Path marker = envDir.resolve(READY_MARKER);
        Path manifestPath = envDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(marker) || !Files.isRegularFile(manifestPath)) {
            return false;
        }
        try {
            return manifestJson.equals(Files.readString(manifestPath, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            log.warn("Unable to read environment manifest {}: {}", manifestPath, ex.getMessage());
            return false;
        }
    }

    private static double elapsedMs(long startedNanos) {
        return Math.round((System.nanoTime() - startedNanos) / 100_000.0) / 10.0;
    }
}
