package work.dyncall.engine.dependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Ordered, de-duplicated dependency list. Instances are immutable once normalized.
 */
public final class DependencyManifest {
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9_.-]+(:[a-z0-9_.-]+)?$");
    private static final DependencyManifest EMPTY = new DependencyManifest(List.of());

    private final List<Dependency> dependencies;

    private DependencyManifest(List<Dependency> dependencies) {
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public static DependencyManifest empty() {
        return EMPTY;
    }

    public static DependencyManifest of(Dependency... dependencies) {
        var raw = new ArrayList<Object>();
        for (Dependency dependency : dependencies) {
            raw.add(dependency.toMap());
        }
        return normalize(raw);
    }

    /**
     * Validates and canonicalizes a declared dependency list: names are lowercased, versions trimmed
     * and defaulted, entries sorted by (name, version) and duplicates collapsed. Conflicting versions
     * for one name are rejected.
     */
    public static DependencyManifest normalize(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (!(raw instanceof List<?> entries)) {
            throw invalid("dependencies must be an array");
        }
        Map<String, String> versionsByName = new LinkedHashMap<>();
        List<Dependency> normalized = new ArrayList<>();
        for (int index = 0; index < entries.size(); index++) {
            Object entry = entries.get(index);
            if (!(entry instanceof Map<?, ?> map)) {
                throw invalid("dependencies[" + index + "] must be an object");
            }
            String name = extractName(map, index);
            String version = extractVersion(map, index);
            String existing = versionsByName.get(name);
            if (existing != null && !existing.equals(version)) {
                throw invalid("dependencies[" + index + "] conflicts with prior declaration for '"
                    + name + "' (" + existing + " vs " + version + ")");
            }
            if (existing == null) {
                versionsByName.put(name, version);
                normalized.add(new Dependency(name, version));
            }
        }
        Collections.sort(normalized);
        return normalized.isEmpty() ? EMPTY : new DependencyManifest(normalized);
    }

    private static String extractName(Map<?, ?> entry, int index) {
        Object rawName = entry.get("name");
        if (!(rawName instanceof String str) || str.isBlank()) {
            throw invalid("dependencies[" + index + "].name must be a non-empty string");
        }
        String name = str.trim().toLowerCase(Locale.ROOT);
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw invalid("dependencies[" + index + "].name is invalid: \"" + str + "\"");
        }
        return name;
    }

    private static String extractVersion(Map<?, ?> entry, int index) {
        if (!entry.containsKey("version") || entry.get("version") == null) {
            return Dependency.ANY_VERSION;
        }
        Object rawVersion = entry.get("version");
        if (!(rawVersion instanceof String str) || str.isBlank()) {
            throw invalid("dependencies[" + index + "].version must be a non-empty string when provided");
        }
        return str.trim();
    }

    private static DynamicCallException invalid(String message) {
        return new DynamicCallException(ErrorType.INVALID_DEPENDENCY_MANIFEST, message);
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public boolean isEmpty() {
        return dependencies.isEmpty();
    }

    public List<String> names() {
        var names = new ArrayList<String>(dependencies.size());
        for (Dependency dependency : dependencies) {
            names.add(dependency.name());
        }
        return names;
    }

    /**
     * True when every dependency of this manifest is present in {@code incoming} with the same version.
     */
    public boolean isSatisfiedAdditivelyBy(DependencyManifest incoming) {
        Map<String, String> incomingVersions = new LinkedHashMap<>();
        for (Dependency dependency : incoming.dependencies) {
            incomingVersions.put(dependency.name(), dependency.version());
        }
        for (Dependency dependency : dependencies) {
            if (!dependency.version().equals(incomingVersions.get(dependency.name()))) {
                return false;
            }
        }
        return true;
    }

    public List<Map<String, Object>> toList() {
        var list = new ArrayList<Map<String, Object>>(dependencies.size());
        for (Dependency dependency : dependencies) {
            list.add(dependency.toMap());
        }
        return list;
    }

    public String toJson() {
        return JsonValues.toJson(toList());
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DependencyManifest manifest && manifest.dependencies.equals(dependencies);
    }

    @Override
    public int hashCode() {
        return dependencies.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
