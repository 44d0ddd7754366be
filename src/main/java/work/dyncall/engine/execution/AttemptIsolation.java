package work.dyncall.engine.execution;

import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.registry.ToolRegistryStore;

/**
 * Snapshot taken before a fresh attempt executes. Restoring it puts the role memory and the tool
 * registry file back to the state before the attempt, so a retried attempt never sees partial writes.
 */
final class AttemptIsolation {
    private static final Logger log = LoggerFactory.getLogger(AttemptIsolation.class);

    private final Map<String, Object> memory;
    private final byte[] registry;
    private final boolean registryCaptured;

    private AttemptIsolation(Map<String, Object> memory, byte[] registry, boolean registryCaptured) {
        this.memory = memory;
        this.registry = registry;
        this.registryCaptured = registryCaptured;
    }

    static AttemptIsolation capture(RoleMemory memory, ToolRegistryStore store) {
        if (store == null) {
            return new AttemptIsolation(memory.copy(), null, false);
        }
        try {
            return new AttemptIsolation(memory.copy(), store.snapshotBytes(), true);
        } catch (IOException ex) {
            log.warn("Unable to snapshot tool registry {}; it will not be rolled back: {}", store.path(), ex.getMessage());
            return new AttemptIsolation(memory.copy(), null, false);
        }
    }

    void restore(RoleMemory target, ToolRegistryStore store, CallState state) {
        target.replace(memory);
        if (store != null && registryCaptured) {
            try {
                store.restoreBytes(registry);
            } catch (IOException ex) {
                log.warn("Unable to roll back tool registry {}: {}", store.path(), ex.getMessage());
            }
        }
        state.rollbackApplied = true;
    }
}
