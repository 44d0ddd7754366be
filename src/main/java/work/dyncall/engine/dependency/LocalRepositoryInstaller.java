package work.dyncall.engine.dependency;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Resolves dependencies from flat local directories holding {@code <artifact>-<version>.jar} files.
 * With no source directories configured, manifests are recorded but nothing is installed.
 */
public final class LocalRepositoryInstaller implements DependencyInstaller {
    private static final Pattern EXACT_VERSION = Pattern.compile("^[0-9][A-Za-z0-9._-]*$");

    private final List<Path> sourceDirectories;

    public LocalRepositoryInstaller(List<Path> sourceDirectories) {
        this.sourceDirectories = sourceDirectories == null ? List.of() : List.copyOf(sourceDirectories);
    }

    @Override
    public List<Path> resolve(DependencyManifest manifest) {
        if (sourceDirectories.isEmpty()) {
            return List.of();
        }
        List<Path> resolved = new ArrayList<>();
        for (Dependency dependency : manifest.dependencies()) {
            Path jar = locate(dependency).orElseThrow(() -> new DynamicCallException(
                ErrorType.DEPENDENCY_RESOLUTION_FAILED,
                "unable to resolve " + dependency.name() + " (" + dependency.version() + ") from " + sourceDirectories
            ));
            resolved.add(jar);
        }
        return resolved;
    }

    @Override
    public void install(List<Path> resolved, Path libDirectory) throws IOException {
        Files.createDirectories(libDirectory);
        for (Path jar : resolved) {
            Files.copy(jar, libDirectory.resolve(jar.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Optional<Path> locate(Dependency dependency) {
        String artifact = dependency.name().contains(":")
            ? dependency.name().substring(dependency.name().indexOf(':') + 1)
            : dependency.name();
        boolean exact = EXACT_VERSION.matcher(dependency.version()).matches();
        for (Path directory : sourceDirectories) {
            if (!Files.isDirectory(directory)) continue;
            if (exact) {
                Path candidate = directory.resolve(artifact + "-" + dependency.version() + ".jar");
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
                continue;
            }
            Optional<Path> latest = latestMatching(directory, artifact);
            if (latest.isPresent()) {
                return latest;
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> latestMatching(Path directory, String artifact) {
        Path plain = directory.resolve(artifact + ".jar");
        if (Files.isRegularFile(plain)) {
            return Optional.of(plain);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> {
                    String file = path.getFileName().toString();
                    return file.startsWith(artifact + "-") && file.endsWith(".jar");
                })
                .max(Comparator.comparing(path -> path.getFileName().toString()));
        } catch (IOException ex) {
            throw new DynamicCallException(ErrorType.DEPENDENCY_RESOLUTION_FAILED,
                "unable to list source directory " + directory + ": " + ex.getMessage(), ex);
        }
    }
}
