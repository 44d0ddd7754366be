package work.dyncall.engine.artifact;

import java.nio.file.Path;
import work.dyncall.engine.shared.Hashing;

/**
 * File layout under the toolstore root.
 */
public final class ArtifactPaths {
    private static final int MAX_SEGMENT = 48;

    private ArtifactPaths() {}

    public static Path artifactsDir(Path root) {
        return root.resolve("artifacts");
    }

    public static Path artifactFile(Path root, String role, String method) {
        return artifactsDir(root).resolve(segment(role)).resolve(segment(method) + ".json");
    }

    public static Path registryFile(Path root) {
        return root.resolve("registry.json");
    }

    public static Path patternsFile(Path root) {
        return root.resolve("patterns.json");
    }

    public static Path environmentsDir(Path root) {
        return root.resolve("environments");
    }

    /**
     * Lowercased name with non-alphanumerics replaced by {@code _}, cut to 48 characters and suffixed
     * with the first 8 hex digits of the name's SHA-256, so distinct names never share a file.
     */
    public static String segment(String name) {
        String lowered = name.toLowerCase().replaceAll("[^a-z0-9]", "_");
        if (lowered.length() > MAX_SEGMENT) {
            lowered = lowered.substring(0, MAX_SEGMENT);
        }
        return lowered + "-" + Hashing.sha256Hex(name).substring(0, 8);
    }
}
