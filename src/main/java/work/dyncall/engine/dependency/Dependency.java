package work.dyncall.engine.dependency;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized dependency declaration.
 */
public record Dependency(String name, String version) implements Comparable<Dependency> {
    public static final String ANY_VERSION = ">= 0";

    public Dependency {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }

    @Override
    public int compareTo(Dependency other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : version.compareTo(other.version);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("version", version);
        return map;
    }
}
