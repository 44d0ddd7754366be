package work.dyncall.engine.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.artifact.ArtifactPaths;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.AtomicFiles;
import work.dyncall.engine.shared.Timestamps;

/**
 * Bounded per-role log of the capability patterns seen in generated and repaired programs
 * ({@code <root>/patterns.json}). Only the latest {@value #RETENTION} events per role are kept.
 */
public final class PatternMemoryStore {
    private static final Logger log = LoggerFactory.getLogger(PatternMemoryStore.class);

    public static final int SCHEMA_VERSION = 1;
    public static final int RETENTION = 50;

    private final Path path;

    public PatternMemoryStore(Path root) {
        this.path = ArtifactPaths.patternsFile(root);
    }

    public Path path() {
        return path;
    }

    public static Map<String, Object> event(String role, String method, List<String> patterns, Outcome outcome) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Timestamps.now());
        event.put("role", role);
        event.put("method_name", method);
        event.put("capability_patterns", new ArrayList<>(new LinkedHashSet<>(patterns == null ? List.<String>of() : patterns)));
        event.put("outcome_status", outcome == null ? null : outcome.status().wireName());
        event.put("error_type", outcome == null ? null : outcome.errorType());
        return event;
    }

    public synchronized void append(String role, Map<String, Object> event) throws IOException {
        Map<String, Object> roles = loadRoles();
        List<Object> events = new ArrayList<>(eventsOf(roles.get(role)));
        events.add(normalizeEvent(event));
        if (events.size() > RETENTION) {
            events = new ArrayList<>(events.subList(events.size() - RETENTION, events.size()));
        }
        Map<String, Object> bucket = new LinkedHashMap<>();
        bucket.put("events", events);
        roles.put(role, bucket);
        write(roles);
    }

    /** The latest {@code window} events recorded for {@code role.method}, oldest first. */
    public synchronized List<Map<String, Object>> recentEvents(String role, String method, int window) throws IOException {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Object raw : eventsOf(loadRoles().get(role))) {
            Map<String, Object> event = JsonValues.asObject(raw);
            if (String.valueOf(method).equals(event.get("method_name"))) {
                matching.add(event);
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, window));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    /** Role to its event bucket. Empty when the file is missing, corrupt or from another schema. */
    public synchronized Map<String, Object> loadRoles() throws IOException {
        if (!Files.isRegularFile(path)) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed;
        try {
            parsed = JsonValues.MAPPER.readValue(Files.readString(path), JsonValues.MAP_REF);
        } catch (JsonProcessingException ex) {
            Path moved = AtomicFiles.quarantine(path);
            log.warn("Quarantined corrupt pattern store {} ({})", moved.getFileName(), ex.getOriginalMessage());
            return new LinkedHashMap<>();
        }
        if (parsed == null) {
            return new LinkedHashMap<>();
        }
        Object schema = parsed.get("schema_version");
        if (schema != null && JsonValues.intValue(schema, -1) != SCHEMA_VERSION) {
            log.debug("Ignoring pattern store with schema_version={}", schema);
            return new LinkedHashMap<>();
        }
        Map<String, Object> roles = new LinkedHashMap<>();
        if (parsed.get("roles") instanceof Map<?, ?> raw) {
            raw.forEach((role, bucket) -> {
                if (bucket instanceof Map<?, ?>) {
                    List<Object> events = new ArrayList<>();
                    for (Object event : eventsOf(bucket)) {
                        if (event instanceof Map<?, ?> entry) {
                            events.add(normalizeEvent(JsonValues.asObject(entry)));
                        }
                    }
                    Map<String, Object> normalized = new LinkedHashMap<>();
                    normalized.put("events", events);
                    roles.put(String.valueOf(role), normalized);
                }
            });
        }
        return roles;
    }

    private void write(Map<String, Object> roles) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schema_version", SCHEMA_VERSION);
        payload.put("roles", roles);
        AtomicFiles.write(path, JsonValues.PRETTY.writeValueAsString(payload));
    }

    private static List<?> eventsOf(Object bucket) {
        if (bucket instanceof Map<?, ?> map && map.get("events") instanceof List<?> events) {
            return events;
        }
        return List.of();
    }

    private static Map<String, Object> normalizeEvent(Map<String, Object> event) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("timestamp", String.valueOf(event.getOrDefault("timestamp", "")));
        normalized.put("role", String.valueOf(event.getOrDefault("role", "")));
        normalized.put("method_name", String.valueOf(event.getOrDefault("method_name", "")));
        LinkedHashSet<String> patterns = new LinkedHashSet<>();
        if (event.get("capability_patterns") instanceof List<?> raw) {
            raw.forEach(pattern -> patterns.add(String.valueOf(pattern)));
        }
        normalized.put("capability_patterns", new ArrayList<>(patterns));
        normalized.put("outcome_status", event.get("outcome_status"));
        normalized.put("error_type", event.get("error_type"));
        return normalized;
    }
}
