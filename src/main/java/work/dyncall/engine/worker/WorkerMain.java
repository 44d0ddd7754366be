package work.dyncall.engine.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.FileDescriptor;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.failure.FailureNormalizer;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.sandbox.ExecutionSandbox;
import work.dyncall.engine.sandbox.SandboxCapabilities;
import work.dyncall.engine.sandbox.SandboxRequest;
import work.dyncall.engine.sandbox.SandboxResult;

/**
 * Worker process entry point: reads one request per stdin line and writes one response per stdout line
 * until stdin closes. The parent enforces deadlines, so programs run here without a sandbox timeout.
 */
public final class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {}

    public static void main(String[] args) throws IOException {
        PrintStream protocolOut = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        // anything else printing to stdout would corrupt the framing
        System.setOut(System.err);

        long pid = ProcessHandle.current().pid();
        ExecutionSandbox sandbox = ExecutionSandbox.forWorker(Duration.ZERO);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerResponse response = handle(sandbox, line, pid);
                protocolOut.println(WorkerProtocol.encode(response));
            }
        }
        log.debug("Worker {} stdin closed, exiting", pid);
    }

    static WorkerResponse handle(ExecutionSandbox sandbox, String line, long pid) {
        WorkerRequest request;
        try {
            request = WorkerProtocol.decodeRequest(line);
        } catch (JsonProcessingException ex) {
            return WorkerResponse.error(null, ErrorType.EXECUTION.wireName(), "unreadable request: " + ex.getOriginalMessage(), pid);
        }
        if (request.ipcVersion() != WorkerProtocol.IPC_VERSION) {
            return WorkerResponse.error(request.callId(), ErrorType.EXECUTION.wireName(),
                "unsupported ipc_version " + request.ipcVersion() + ", expected " + WorkerProtocol.IPC_VERSION, pid);
        }
        try {
            SandboxResult result = sandbox.execute(
                new SandboxRequest(request.role(), request.methodName(), request.code(), request.args(), request.kwargs(),
                    JsonValues.deepCloneMap(request.contextSnapshot()), Map.of()),
                SandboxCapabilities.none());
            Object value = result.value() instanceof Outcome outcome ? outcome.encode() : result.value();
            if (!JsonValues.isPlainData(value)) {
                return WorkerResponse.error(request.callId(), ErrorType.NON_SERIALIZABLE_RESULT.wireName(),
                    request.role() + "." + request.methodName() + " returned a value that cannot cross the worker boundary", pid);
            }
            if (!JsonValues.isPlainData(result.context())) {
                return WorkerResponse.error(request.callId(), ErrorType.NON_SERIALIZABLE_RESULT.wireName(),
                    request.role() + "." + request.methodName() + " left memory that cannot cross the worker boundary", pid);
            }
            return WorkerResponse.ok(request.callId(), value, result.context(), pid);
        } catch (DynamicCallException ex) {
            return WorkerResponse.error(request.callId(), ex.errorType(), ex.getMessage(), pid);
        } catch (RuntimeException ex) {
            return WorkerResponse.error(request.callId(), ErrorType.EXECUTION.wireName(), FailureNormalizer.messageOf(ex), pid);
        }
    }
}
