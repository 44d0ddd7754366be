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
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.artifact.ArtifactPaths;
import work.dyncall.engine.artifact.PromotionDecision;
import work.dyncall.engine.guardrail.StateKeys;
import work.dyncall.engine.runtime.EngineInfo;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.AtomicFiles;
import work.dyncall.engine.shared.Timestamps;

/**
 * JSON-backed registry of delegated tools ({@code <root>/registry.json}). Every mutation rereads
 * the file, so concurrent engines sharing a toolstore merge rather than overwrite each other's tools.
 */
public final class ToolRegistryStore {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistryStore.class);

    private final Path path;

    public ToolRegistryStore(Path root) {
        this.path = ArtifactPaths.registryFile(root);
    }

    public Path path() {
        return path;
    }

    /** Tool name to metadata. Empty when the file is missing, corrupt or from another schema. */
    public synchronized Map<String, Object> loadTools() throws IOException {
        if (!Files.isRegularFile(path)) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed;
        try {
            parsed = JsonValues.MAPPER.readValue(Files.readString(path), JsonValues.MAP_REF);
        } catch (JsonProcessingException ex) {
            Path moved = AtomicFiles.quarantine(path);
            log.warn("Quarantined corrupt tool registry {} ({})", moved.getFileName(), ex.getOriginalMessage());
            return new LinkedHashMap<>();
        }
        if (parsed == null) {
            return new LinkedHashMap<>();
        }
        Object schema = parsed.get("schema_version");
        if (schema != null && JsonValues.intValue(schema, -1) != EngineInfo.SCHEMA_VERSION) {
            log.debug("Ignoring tool registry with schema_version={}", schema);
            return new LinkedHashMap<>();
        }
        Map<String, Object> tools = new LinkedHashMap<>();
        if (parsed.get("tools") instanceof Map<?, ?> raw) {
            raw.forEach((name, metadata) -> {
                if (metadata instanceof Map<?, ?> entry) {
                    tools.put(String.valueOf(name), JsonValues.deepCloneMap(entry));
                }
            });
        }
        return tools;
    }

    /**
     * Registers (or refreshes) a delegated tool. Method names are merged; counters survive.
     */
    public synchronized Map<String, Object> register(String name, String purpose, List<String> methods,
                                                     Map<String, Object> deliverable) throws IOException {
        Map<String, Object> tools = loadTools();
        Map<String, Object> existing = tools.get(name) instanceof Map<?, ?> raw ? JsonValues.asObject(raw) : new LinkedHashMap<>();
        String timestamp = Timestamps.now();
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        if (purpose != null && !purpose.isBlank()) {
            merged.put("purpose", purpose.trim());
        }
        Set<String> mergedMethods = new LinkedHashSet<>(methodNames(existing));
        if (methods != null) {
            methods.stream().map(String::trim).filter(method -> !method.isEmpty()).forEach(mergedMethods::add);
        }
        merged.put("methods", new ArrayList<>(mergedMethods));
        if (deliverable != null) {
            merged.put("deliverable", JsonValues.deepCloneMap(deliverable));
        }
        merged.putIfAbsent("created_at", timestamp);
        merged.put("last_used_at", timestamp);
        merged.put("usage_count", JsonValues.intValue(existing.get("usage_count"), 0) + 1);
        merged.put("success_count", JsonValues.intValue(existing.get("success_count"), 0));
        merged.put("failure_count", JsonValues.intValue(existing.get("failure_count"), 0));
        merged.putIfAbsent("lifecycle_state", "candidate");
        tools.put(name, merged);
        writeTools(tools);
        return merged;
    }

    /**
     * Records a completed call against a registered tool. Unregistered tools are left alone.
     */
    public synchronized void touchUsage(String name, String method, Outcome outcome, String code,
                                        PromotionDecision decision) throws IOException {
        Map<String, Object> tools = loadTools();
        if (!(tools.get(name) instanceof Map<?, ?> raw)) {
            return;
        }
        Map<String, Object> updated = JsonValues.asObject(raw);
        updated.put("last_used_at", Timestamps.now());
        updated.put("usage_count", JsonValues.intValue(updated.get("usage_count"), 0) + 1);
        String counter = outcome != null && outcome.isOk() ? "success_count" : "failure_count";
        updated.put(counter, JsonValues.intValue(updated.get(counter), 0) + 1);
        if (outcome != null && outcome.isOk() && method != null && !method.isBlank()) {
            List<String> methods = methodNames(updated);
            if (!methods.contains(method)) {
                methods.add(method);
            }
            updated.put("methods", methods);
        }
        List<String> keys = code == null ? List.of() : StateKeys.fromCode(code);
        if (!keys.isEmpty()) {
            Map<String, Object> profiles = updated.get("method_state_keys") instanceof Map<?, ?> existing
                ? JsonValues.asObject(existing)
                : new LinkedHashMap<>();
            profiles.put(method, new ArrayList<>(keys));
            updated.put("method_state_keys", profiles);
            updated.put("state_key_consistency_ratio", consistencyRatio(profiles));
        }
        if (decision != null) {
            updated.put("lifecycle_state", decision.state().wireName());
            updated.put("lifecycle_decision", decision.decision());
            updated.put("promotion_policy_version", decision.policyVersion());
            updated.put("lifecycle_updated_at", Timestamps.now());
        }
        tools.put(name, updated);
        writeTools(tools);
    }

    public synchronized void writeTools(Map<String, Object> tools) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schema_version", EngineInfo.SCHEMA_VERSION);
        payload.put("tools", tools);
        AtomicFiles.write(path, JsonValues.PRETTY.writeValueAsString(payload));
    }

    /** Raw file contents for attempt snapshots, {@code null} when the file does not exist. */
    public synchronized byte[] snapshotBytes() throws IOException {
        return Files.isRegularFile(path) ? Files.readAllBytes(path) : null;
    }

    public synchronized void restoreBytes(byte[] snapshot) throws IOException {
        if (snapshot == null) {
            Files.deleteIfExists(path);
        } else {
            AtomicFiles.write(path, snapshot);
        }
    }

    private static List<String> methodNames(Map<String, Object> metadata) {
        List<String> names = new ArrayList<>();
        if (metadata.get("methods") instanceof List<?> raw) {
            for (Object entry : raw) {
                String name = entry == null ? "" : String.valueOf(entry).trim();
                if (!name.isEmpty() && !names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static double consistencyRatio(Map<String, Object> profiles) {
        Map<String, Integer> tally = new LinkedHashMap<>();
        int total = 0;
        for (Object keys : profiles.values()) {
            if (keys instanceof List<?> list && !list.isEmpty()) {
                List<String> sorted = new ArrayList<>();
                list.forEach(key -> sorted.add(String.valueOf(key)));
                sorted.sort(null);
                tally.merge(sorted.get(0), 1, Integer::sum);
                total++;
            }
        }
        if (total == 0) {
            return 1.0;
        }
        int max = tally.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return Math.round((double) max / total * 10000.0) / 10000.0;
    }
}
