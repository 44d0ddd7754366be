package work.dyncall.engine.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.sandbox.ExecutionSandbox;

class WorkerMainTest {
    private final ExecutionSandbox sandbox = new ExecutionSandbox(Duration.ofSeconds(5));

    private static String line(int ipcVersion, String code, Map<String, Object> context) throws Exception {
        return WorkerProtocol.encode(new WorkerRequest(ipcVersion, "call-1", "Scraper", "count", code, List.of(2), Map.of(), context));
    }

    @Test
    void runsRequestAndReturnsMemory() throws Exception {
        WorkerResponse response = WorkerMain.handle(sandbox,
            line(WorkerProtocol.IPC_VERSION, "context.seen = (context.seen || 0) + args[0]; return context.seen;", Map.of("seen", 1)), 77);

        assertTrue(response.isOk());
        assertEquals("call-1", response.callId());
        assertEquals(3, response.value());
        assertEquals(3, response.contextSnapshot().get("seen"));
        assertEquals(77L, response.workerPid());
    }

    @Test
    void explicitOutcomesAreEncoded() throws Exception {
        WorkerResponse response = WorkerMain.handle(sandbox,
            line(WorkerProtocol.IPC_VERSION, "return api.error('missing_input', 'no url');", Map.of()), 1);

        Outcome decoded = Outcome.coerce(response.value(), "Scraper", "count");
        assertEquals("missing_input", decoded.errorType());
        assertEquals("no url", decoded.errorMessage());
    }

    @Test
    void scriptErrorsComeBackAsExecutionErrors() throws Exception {
        WorkerResponse response = WorkerMain.handle(sandbox,
            line(WorkerProtocol.IPC_VERSION, "throw new Error('boom');", Map.of()), 1);

        assertEquals(WorkerResponse.STATUS_ERROR, response.status());
        assertEquals("execution", response.errorType());
        assertNull(response.value());
    }

    @Test
    void rejectsUnknownIpcVersion() throws Exception {
        WorkerResponse response = WorkerMain.handle(sandbox, line(99, "return 1;", Map.of()), 1);

        assertEquals("execution", response.errorType());
        assertTrue(response.errorMessage().contains("unsupported ipc_version 99"));
    }

    @Test
    void unreadableLine() {
        WorkerResponse response = WorkerMain.handle(sandbox, "{not json", 1);

        assertNull(response.callId());
        assertTrue(response.errorMessage().startsWith("unreadable request"));
    }
}
