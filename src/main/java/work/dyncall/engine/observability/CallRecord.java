package work.dyncall.engine.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.shared.Timestamps;

/**
 * The structured record of one logical invocation, emitted once after its outcome is final.
 */
public record CallRecord(Map<String, Object> fields) {
    public CallRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public static CallRecord of(Invocation invocation, Outcome outcome, double durationMs, Map<String, Object> diagnostics) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("timestamp", Timestamps.now());
        fields.putAll(invocation.frame().toMap());
        fields.put("role", invocation.role());
        fields.put("method", invocation.method());
        fields.put("args", invocation.args());
        fields.put("kwargs", invocation.kwargs());
        fields.put("duration_ms", Math.round(durationMs * 10.0) / 10.0);
        fields.put("outcome_status", outcome.status().wireName());
        if (outcome.isOk()) {
            fields.put("outcome_value", outcome.value());
        } else {
            fields.put("outcome_error_type", outcome.errorType());
            fields.put("outcome_error_message", outcome.errorMessage());
            fields.put("outcome_retriable", outcome.retriable());
            if (!outcome.metadata().isEmpty()) {
                fields.put("outcome_error_metadata", outcome.metadata());
            }
        }
        if (diagnostics != null) {
            diagnostics.forEach(fields::putIfAbsent);
        }
        return new CallRecord(fields);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public String role() {
        return (String) fields.get("role");
    }

    public String method() {
        return (String) fields.get("method");
    }

    public String status() {
        return (String) fields.get("outcome_status");
    }
}
