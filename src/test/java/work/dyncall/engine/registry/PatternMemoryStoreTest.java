package work.dyncall.engine.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.runtime.JsonValues;

class PatternMemoryStoreTest {
    @TempDir
    Path toolstore;

    @Test
    void eventsAreKeptPerRoleAndFilteredByMethod() throws Exception {
        var store = new PatternMemoryStore(toolstore);
        store.append("Reader", PatternMemoryStore.event("Reader", "fetch", List.of("http_fetch", "http_fetch"),
            Outcome.ok(1, "Reader", "fetch")));
        store.append("Reader", PatternMemoryStore.event("Reader", "parse", List.of("xml_parse"),
            Outcome.error("parse_failed", "bad", true, "Reader", "parse")));
        store.append("Other", PatternMemoryStore.event("Other", "fetch", List.of(), Outcome.ok(2, "Other", "fetch")));

        List<Map<String, Object>> fetches = store.recentEvents("Reader", "fetch", 5);
        assertEquals(1, fetches.size());
        assertEquals(List.of("http_fetch"), fetches.get(0).get("capability_patterns"));
        assertEquals("ok", fetches.get(0).get("outcome_status"));

        Map<String, Object> parse = store.recentEvents("Reader", "parse", 1).get(0);
        assertEquals("error", parse.get("outcome_status"));
        assertEquals("parse_failed", parse.get("error_type"));

        Map<String, Object> saved = JsonValues.MAPPER.readValue(Files.readString(store.path()), JsonValues.MAP_REF);
        assertEquals(PatternMemoryStore.SCHEMA_VERSION, saved.get("schema_version"));
        assertEquals(2, ((Map<?, ?>) saved.get("roles")).size());
    }

    @Test
    void retentionKeepsOnlyTheLatestEvents() throws Exception {
        var store = new PatternMemoryStore(toolstore);
        for (int i = 0; i < PatternMemoryStore.RETENTION + 5; i++) {
            store.append("Busy", PatternMemoryStore.event("Busy", "run-" + i, List.of(), Outcome.ok(i, "Busy", "run")));
        }

        List<?> events = (List<?>) ((Map<?, ?>) store.loadRoles().get("Busy")).get("events");
        assertEquals(PatternMemoryStore.RETENTION, events.size());
        assertEquals("run-5", ((Map<?, ?>) events.get(0)).get("method_name"));
        assertTrue(store.recentEvents("Busy", "run-0", 10).isEmpty());
    }

    @Test
    void windowReturnsTheNewestEventsOldestFirst() throws Exception {
        var store = new PatternMemoryStore(toolstore);
        for (int i = 0; i < 4; i++) {
            store.append("Feed", PatternMemoryStore.event("Feed", "poll", List.of("p" + i), Outcome.ok(i, "Feed", "poll")));
        }

        List<Map<String, Object>> recent = store.recentEvents("Feed", "poll", 2);
        assertEquals(List.of("p2"), recent.get(0).get("capability_patterns"));
        assertEquals(List.of("p3"), recent.get(1).get("capability_patterns"));
    }

    @Test
    void corruptStoreIsQuarantinedAndTreatedAsEmpty() throws Exception {
        var store = new PatternMemoryStore(toolstore);
        Files.createDirectories(store.path().getParent());
        Files.writeString(store.path(), "{not json");

        assertTrue(store.loadRoles().isEmpty());
        assertFalse(Files.exists(store.path()));
        try (var siblings = Files.list(toolstore)) {
            assertTrue(siblings.anyMatch(file -> file.getFileName().toString().startsWith("patterns.json.corrupt")));
        }
    }

    @Test
    void otherSchemaVersionsAreIgnored() throws Exception {
        var store = new PatternMemoryStore(toolstore);
        Files.createDirectories(store.path().getParent());
        Files.writeString(store.path(), "{\"schema_version\": 7, \"roles\": {\"Reader\": {\"events\": [{\"method_name\": \"fetch\"}]}}}");

        assertTrue(store.recentEvents("Reader", "fetch", 5).isEmpty());
    }
}
