package work.dyncall.engine.dependency;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A materialized runtime environment for one manifest.
 */
public record EnvironmentHandle(
    String envId,
    Path directory,
    DependencyManifest manifest,
    boolean cacheHit,
    double prepareMs,
    double resolveMs,
    double installMs
) {
    public EnvironmentHandle {
        Objects.requireNonNull(envId, "envId");
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(manifest, "manifest");
    }

    public Path libDirectory() {
        return directory.resolve("lib");
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("env_id", envId);
        map.put("env_dir", directory.toString());
        map.put("environment_cache_hit", cacheHit);
        map.put("env_prepare_ms", prepareMs);
        map.put("env_resolve_ms", resolveMs);
        map.put("env_install_ms", installMs);
        return map;
    }
}
