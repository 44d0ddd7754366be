package work.dyncall.engine.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One response line read from a worker, later enriched by the supervisor with restart bookkeeping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerResponse(
    @JsonProperty("ipc_version") Integer ipcVersion,
    @JsonProperty("call_id") String callId,
    @JsonProperty("status") String status,
    @JsonProperty("value") Object value,
    @JsonProperty("context_snapshot") Map<String, Object> contextSnapshot,
    @JsonProperty("error_type") String errorType,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("worker_pid") Long workerPid,
    @JsonProperty("worker_restart_count") Integer workerRestartCount,
    @JsonProperty("retriable") Boolean retriable
) {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static WorkerResponse ok(String callId, Object value, Map<String, Object> context, long pid) {
        return new WorkerResponse(WorkerProtocol.IPC_VERSION, callId, STATUS_OK, value, context, null, null, pid, null, null);
    }

    public static WorkerResponse error(String callId, String errorType, String errorMessage, long pid) {
        return new WorkerResponse(WorkerProtocol.IPC_VERSION, callId, STATUS_ERROR, null, null, errorType, errorMessage, pid, null, null);
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    WorkerResponse supervised(Long pid, int restartCount, Boolean retriableFlag) {
        return new WorkerResponse(ipcVersion, callId, status, value, contextSnapshot, errorType, errorMessage,
            pid == null ? workerPid : pid, restartCount, retriableFlag);
    }
}
