package work.dyncall.engine.dependency;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Allow/block lists and source restrictions checked before an environment is materialized.
 */
public record DependencyPolicy(List<String> allowed, List<String> blocked, SourceMode sourceMode, List<String> sources) {
    private static final List<String> PUBLIC_SOURCE_HOSTS = List.of(
        "repo.maven.apache.org",
        "repo1.maven.org",
        "central.sonatype.com"
    );

    public DependencyPolicy {
        allowed = allowed == null ? null : List.copyOf(allowed);
        blocked = blocked == null ? List.of() : List.copyOf(blocked);
        sourceMode = sourceMode == null ? SourceMode.PUBLIC : sourceMode;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static DependencyPolicy permissive() {
        return new DependencyPolicy(null, List.of(), SourceMode.PUBLIC, List.of());
    }

    public void enforce(DependencyManifest manifest) {
        Objects.requireNonNull(manifest, "manifest");
        if (manifest.isEmpty()) {
            return;
        }
        validateSources();
        for (Dependency dependency : manifest.dependencies()) {
            String name = dependency.name();
            if (allowed != null && !allowed.contains(name)) {
                throw violation("dependency policy violation for " + name + ": not in allowed list");
            }
            if (blocked.contains(name)) {
                throw violation("dependency policy violation for " + name + ": blocked");
            }
        }
    }

    private void validateSources() {
        if (sourceMode != SourceMode.INTERNAL_ONLY) {
            return;
        }
        if (sources.isEmpty()) {
            throw violation("source_mode internal_only requires at least one internal source");
        }
        for (String source : sources) {
            String lowered = source.toLowerCase(Locale.ROOT);
            for (String host : PUBLIC_SOURCE_HOSTS) {
                if (lowered.contains(host)) {
                    throw violation("source_mode internal_only forbids public source " + source);
                }
            }
        }
    }

    private static DynamicCallException violation(String message) {
        return new DynamicCallException(ErrorType.DEPENDENCY_POLICY_VIOLATION, message);
    }

    public enum SourceMode {
        PUBLIC,
        INTERNAL_ONLY;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static SourceMode from(String raw) {
            if (raw == null || raw.isBlank()) {
                return PUBLIC;
            }
            return "internal_only".equalsIgnoreCase(raw.trim()) ? INTERNAL_ONLY : PUBLIC;
        }
    }
}
