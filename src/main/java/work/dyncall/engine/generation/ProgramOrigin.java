package work.dyncall.engine.generation;

import java.util.Locale;

public enum ProgramOrigin {
    FRESH,
    PERSISTED,
    REPAIRED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
