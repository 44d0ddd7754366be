package work.dyncall.engine.guardrail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Opt-in coordination contract for a role: named constraints saying which sibling methods share a
 * memory slot, either by agreement ({@code coordination}) or on a fixed key ({@code prescriptive}).
 */
public record ContinuityProfile(String role, int version, Map<String, Constraint> constraints) {
    public ContinuityProfile {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("continuity profile role must be provided");
        }
        if (version <= 0) {
            throw new IllegalArgumentException("continuity profile version must be >= 1");
        }
        constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints == null ? Map.of() : constraints));
    }

    /**
     * Parses the plain-map form {@code {role, version, constraints: {name: {kind, methods, mode, canonical_key}}}}.
     */
    public static ContinuityProfile fromMap(Map<String, Object> raw, String expectedRole) {
        Objects.requireNonNull(raw, "raw");
        String role = JsonValues.optionalString(raw.get("role"));
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("continuity profile role must be provided");
        }
        if (expectedRole != null && !expectedRole.equals(role.trim())) {
            throw new IllegalArgumentException("continuity profile role must match agent role '" + expectedRole + "'");
        }
        int version = JsonValues.intValue(raw.get("version"), 0);
        Map<String, Constraint> constraints = new LinkedHashMap<>();
        JsonValues.asObject(raw.get("constraints")).forEach((name, entry) ->
            constraints.put(name, Constraint.fromMap(name, JsonValues.asObject(entry))));
        return new ContinuityProfile(role.trim(), version, constraints);
    }

    public List<Map.Entry<String, Constraint>> constraintsFor(String method) {
        List<Map.Entry<String, Constraint>> applicable = new ArrayList<>();
        for (Map.Entry<String, Constraint> entry : constraints.entrySet()) {
            if (entry.getValue().methods().contains(method)) {
                applicable.add(entry);
            }
        }
        return applicable;
    }

    public enum Mode {
        COORDINATION,
        PRESCRIPTIVE;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public record Constraint(String kind, List<String> methods, Mode mode, String canonicalKey) {
        public static final String SHARED_STATE_SLOT = "shared_state_slot";

        public Constraint {
            kind = kind == null || kind.isBlank() ? SHARED_STATE_SLOT : kind;
            if (!SHARED_STATE_SLOT.equals(kind)) {
                throw new IllegalArgumentException("unsupported continuity constraint kind '" + kind + "'");
            }
            methods = List.copyOf(methods == null ? List.of() : methods);
            if (methods.isEmpty()) {
                throw new IllegalArgumentException("continuity constraint requires at least one method");
            }
            mode = mode == null ? Mode.COORDINATION : mode;
            if (mode == Mode.PRESCRIPTIVE && (canonicalKey == null || canonicalKey.isBlank())) {
                throw new IllegalArgumentException("prescriptive continuity constraint requires canonical_key");
            }
        }

        static Constraint fromMap(String name, Map<String, Object> raw) {
            String modeName = JsonValues.optionalString(raw.get("mode"));
            Mode mode;
            try {
                mode = modeName == null || modeName.isBlank() ? Mode.COORDINATION : Mode.valueOf(modeName.trim().toUpperCase());
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("continuity constraint '" + name + "' has unsupported mode '" + modeName + "'", ex);
            }
            LinkedHashSet<String> methods = new LinkedHashSet<>();
            for (Object method : JsonValues.asList(raw.get("methods"))) {
                String value = String.valueOf(method).trim();
                if (!value.isEmpty()) {
                    methods.add(value);
                }
            }
            return new Constraint(JsonValues.optionalString(raw.get("kind")), new ArrayList<>(methods), mode,
                JsonValues.optionalString(raw.get("canonical_key")));
        }
    }
}
