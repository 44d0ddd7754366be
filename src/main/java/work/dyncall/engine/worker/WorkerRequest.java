package work.dyncall.engine.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * One request line sent to a worker process.
 */
public record WorkerRequest(
    @JsonProperty("ipc_version") int ipcVersion,
    @JsonProperty("call_id") String callId,
    @JsonProperty("role") String role,
    @JsonProperty("method_name") String methodName,
    @JsonProperty("code") String code,
    @JsonProperty("args") List<Object> args,
    @JsonProperty("kwargs") Map<String, Object> kwargs,
    @JsonProperty("context_snapshot") Map<String, Object> contextSnapshot
) {
    public WorkerRequest {
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
        contextSnapshot = contextSnapshot == null ? Map.of() : contextSnapshot;
    }
}
