package work.dyncall.engine.registry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.dyncall.engine.api.Outcome;

class ToolRegistryStoreTest {
    @TempDir
    Path toolstore;

    @Test
    void registerMergesMethodsAndKeepsCounters() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        registry.register("Parser", "parse documents", List.of("parse"), Map.of("required", List.of("body")));
        registry.touchUsage("Parser", "parse", Outcome.ok(1, "Parser", "parse"), "return 1;", null);
        Map<String, Object> merged = registry.register("Parser", null, List.of("summarize"), null);

        assertEquals(List.of("parse", "summarize"), merged.get("methods"));
        assertEquals("parse documents", merged.get("purpose"));
        assertEquals(1, merged.get("success_count"));
        assertEquals(Map.of("required", List.of("body")), merged.get("deliverable"));
    }

    @Test
    void touchUsageRecordsStateKeysPerMethod() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        registry.register("Cart", "shopping cart", List.of("add"), null);
        registry.touchUsage("Cart", "add", Outcome.ok(true, "Cart", "add"), "context.items = args; return true;", null);
        registry.touchUsage("Cart", "list", Outcome.ok(List.of(), "Cart", "list"), "return context.basket;", null);

        @SuppressWarnings("unchecked")
        Map<String, Object> tool = (Map<String, Object>) registry.loadTools().get("Cart");
        assertEquals(Map.of("add", List.of("items"), "list", List.of("basket")), tool.get("method_state_keys"));
        assertEquals(0.5, tool.get("state_key_consistency_ratio"));
        assertEquals(List.of("add", "list"), tool.get("methods"));
    }

    @Test
    void failuresAreCountedButMethodsNotAdded() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        registry.register("Cart", "shopping cart", List.of("add"), null);
        registry.touchUsage("Cart", "checkout", Outcome.error("execution", "x", false, "Cart", "checkout"), null, null);

        @SuppressWarnings("unchecked")
        Map<String, Object> tool = (Map<String, Object>) registry.loadTools().get("Cart");
        assertEquals(1, tool.get("failure_count"));
        assertEquals(List.of("add"), tool.get("methods"));
    }

    @Test
    void unregisteredToolsAreIgnored() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        registry.touchUsage("Ghost", "boo", Outcome.ok(1, "Ghost", "boo"), "return 1;", null);
        assertFalse(Files.exists(registry.path()));
    }

    @Test
    void corruptRegistryIsQuarantinedAndTreatedAsEmpty() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        Files.createDirectories(registry.path().getParent());
        Files.writeString(registry.path(), "[oops");

        assertTrue(registry.loadTools().isEmpty());
        assertFalse(Files.exists(registry.path()));
    }

    @Test
    void snapshotsRestoreExactBytes() throws Exception {
        var registry = new ToolRegistryStore(toolstore);
        assertNull(registry.snapshotBytes());
        registry.register("Parser", "parse", List.of("parse"), null);
        byte[] snapshot = registry.snapshotBytes();

        registry.register("Other", "other", List.of("x"), null);
        registry.restoreBytes(snapshot);

        assertArrayEquals(snapshot, registry.snapshotBytes());
        assertEquals(List.of("Parser"), List.copyOf(registry.loadTools().keySet()));
        registry.restoreBytes(null);
        assertFalse(Files.exists(registry.path()));
    }
}
