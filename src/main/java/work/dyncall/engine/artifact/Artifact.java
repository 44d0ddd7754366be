package work.dyncall.engine.artifact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.dyncall.engine.runtime.EngineInfo;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;

/**
 * Persisted program and metadata for one (role, method) pair. Backed by the plain map that is
 * written to disk, so fields written by newer releases survive a load/save cycle.
 */
public final class Artifact {
    public static final int MAX_HISTORY = 3;

    private final Map<String, Object> data;

    Artifact(Map<String, Object> data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public static Artifact template(String role, String method, String contractFingerprint, String model) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("schema_version", EngineInfo.SCHEMA_VERSION);
        data.put("role", role);
        data.put("method_name", method);
        data.put("contract_fingerprint", contractFingerprint == null ? "none" : contractFingerprint);
        data.put("prompt_version", EngineInfo.PROMPT_VERSION);
        data.put("runtime_version", EngineInfo.RUNTIME_VERSION);
        data.put("model", model);
        data.put("cacheable", false);
        data.put("cacheability_reason", "unknown");
        data.put("input_sensitive", false);
        data.put("code_checksum", null);
        data.put("code", "");
        data.put("dependencies", new ArrayList<>());
        data.put("success_count", 0);
        data.put("failure_count", 0);
        data.put("intrinsic_failure_count", 0);
        data.put("adaptive_failure_count", 0);
        data.put("extrinsic_failure_count", 0);
        data.put("recent_failure_rate", 0.0);
        data.put("last_failure_reason", null);
        data.put("last_failure_class", null);
        data.put("repair_count_since_regen", 0);
        data.put("created_at", null);
        data.put("last_used_at", null);
        data.put("last_repaired_at", null);
        data.put("history", new ArrayList<>());
        return new Artifact(data);
    }

    public static Artifact fromMap(Map<String, Object> raw) {
        return new Artifact(JsonValues.deepCloneMap(raw));
    }

    public Map<String, Object> toMap() {
        return data;
    }

    public Artifact copy() {
        return new Artifact(JsonValues.deepCloneMap(data));
    }

    public String role() {
        return JsonValues.optionalString(data.get("role"));
    }

    public String methodName() {
        return JsonValues.optionalString(data.get("method_name"));
    }

    public String code() {
        Object code = data.get("code");
        return code == null ? "" : String.valueOf(code);
    }

    public String codeChecksum() {
        return JsonValues.optionalString(data.get("code_checksum"));
    }

    public List<Object> dependencies() {
        Object deps = data.get("dependencies");
        return deps instanceof List<?> ? JsonValues.asList(deps) : new ArrayList<>();
    }

    /** {@code null} for artifacts written before cacheability metadata existed. */
    public Boolean cacheable() {
        return data.get("cacheable") instanceof Boolean flag ? flag : null;
    }

    public String cacheabilityReason() {
        return JsonValues.optionalString(data.get("cacheability_reason"));
    }

    public boolean inputSensitive() {
        return Boolean.TRUE.equals(data.get("input_sensitive"));
    }

    public String contractFingerprint() {
        String value = JsonValues.optionalString(data.get("contract_fingerprint"));
        return value == null ? "none" : value;
    }

    public String promptVersion() {
        return JsonValues.optionalString(data.get("prompt_version"));
    }

    public String runtimeVersion() {
        return JsonValues.optionalString(data.get("runtime_version"));
    }

    public Integer schemaVersion() {
        Object value = data.get("schema_version");
        return value == null ? null : JsonValues.intValue(value, -1);
    }

    public int successCount() {
        return JsonValues.intValue(data.get("success_count"), 0);
    }

    public int failureCount() {
        return JsonValues.intValue(data.get("failure_count"), 0);
    }

    public double recentFailureRate() {
        return JsonValues.doubleValue(data.get("recent_failure_rate"), 0.0);
    }

    public int repairCountSinceRegen() {
        return JsonValues.intValue(data.get("repair_count_since_regen"), 0);
    }

    public String lastFailureClass() {
        return JsonValues.optionalString(data.get("last_failure_class"));
    }

    public int counter(String key) {
        return JsonValues.intValue(data.get(key), 0);
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> history() {
        Object history = data.get("history");
        if (!(history instanceof List)) {
            history = new ArrayList<>();
            data.put("history", history);
        }
        return (List<Map<String, Object>>) history;
    }

    public Map<String, Object> scorecards() {
        return childMap("scorecards");
    }

    public Map<String, Object> versions() {
        return childMap("versions");
    }

    /** Lifecycle root, or {@code null} before the first promotion evaluation. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> lifecycle() {
        Object lifecycle = data.get("lifecycle");
        return lifecycle instanceof Map ? (Map<String, Object>) lifecycle : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> scorecardFor(String checksum) {
        if (checksum == null) {
            return null;
        }
        Object scorecard = scorecards().get(checksum);
        return scorecard instanceof Map ? (Map<String, Object>) scorecard : null;
    }

    public boolean checksumValid() {
        String code = code();
        if (code.isBlank()) {
            return false;
        }
        return Hashing.checksum(code).equals(codeChecksum());
    }

    /** Failures >= 3, failure rate > 0.6 and more failures than successes. */
    public boolean heuristicallyDegraded() {
        int failures = failureCount();
        return failures >= 3 && recentFailureRate() > 0.6 && failures > successCount();
    }

    Object get(String key) {
        return data.get(key);
    }

    void put(String key, Object value) {
        data.put(key, value);
    }

    void increment(String key) {
        data.put(key, counter(key) + 1);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> childMap(String key) {
        Object child = data.get(key);
        if (!(child instanceof Map)) {
            child = new LinkedHashMap<String, Object>();
            data.put(key, child);
        }
        return (Map<String, Object>) child;
    }
}
