package work.dyncall.engine.observability;

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
import work.dyncall.engine.runtime.CallFrame;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.runtime.JsonValues;

class CallRecordTest {
    private static final Invocation INVOCATION = new Invocation("Counter", "increment", List.of(1), Map.of(), CallFrame.root());

    @Test
    void successRecordCarriesValueAndFrame() {
        CallRecord record = CallRecord.of(INVOCATION, Outcome.ok(2, "Counter", "increment"), 12.345, Map.of("attempt_id", 1));

        assertEquals("ok", record.status());
        assertEquals(2, record.get("outcome_value"));
        assertEquals(12.3, record.get("duration_ms"));
        assertEquals(0, record.get("depth"));
        assertEquals(INVOCATION.frame().callId(), record.get("call_id"));
        assertEquals(1, record.get("attempt_id"));
        assertFalse(record.fields().containsKey("outcome_error_type"));
    }

    @Test
    void diagnosticsNeverOverrideCoreFields() {
        Outcome error = Outcome.error("missing_input", "no page", false, Map.of("field", "url"), "Counter", "increment");

        CallRecord record = CallRecord.of(INVOCATION, error, 1.0, Map.of("role", "Other", "outcome_status", "ok"));

        assertEquals("Counter", record.role());
        assertEquals("error", record.status());
        assertEquals("missing_input", record.get("outcome_error_type"));
        assertEquals(Map.of("field", "url"), record.get("outcome_error_metadata"));
        assertNull(record.get("outcome_value"));
    }

    @Test
    void jsonlSinkAppendsOneLinePerRecord(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("logs/calls.jsonl");
        JsonlCallRecordSink sink = new JsonlCallRecordSink(file);

        sink.emit(CallRecord.of(INVOCATION, Outcome.ok(1, "Counter", "increment"), 1.0, Map.of()));
        sink.emit(CallRecord.of(INVOCATION, Outcome.ok(2, "Counter", "increment"), 1.0, Map.of()));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        Map<String, Object> second = JsonValues.MAPPER.readValue(lines.get(1), JsonValues.MAP_REF);
        assertEquals(2, second.get("outcome_value"));
        assertTrue(second.containsKey("timestamp"));
    }
}
