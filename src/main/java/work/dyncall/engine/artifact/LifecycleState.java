package work.dyncall.engine.artifact;

public enum LifecycleState {
    CANDIDATE,
    PROBATION,
    DURABLE,
    DEGRADED;

    public String wireName() {
        return name().toLowerCase();
    }

    public static LifecycleState fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return CANDIDATE;
        }
        for (LifecycleState state : values()) {
            if (state.wireName().equals(raw.trim())) {
                return state;
            }
        }
        return CANDIDATE;
    }
}
