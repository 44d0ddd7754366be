package work.dyncall.engine.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Line-delimited JSON framing shared by the parent and worker processes.
 */
public final class WorkerProtocol {
    public static final int IPC_VERSION = 1;

    private WorkerProtocol() {}

    public static String encode(Object message) throws JsonProcessingException {
        String line = JsonValues.MAPPER.writeValueAsString(message);
        if (line.indexOf('\n') >= 0) {
            throw new IllegalStateException("encoded worker message must fit on one line");
        }
        return line;
    }

    public static WorkerRequest decodeRequest(String line) throws JsonProcessingException {
        return JsonValues.MAPPER.readValue(line, WorkerRequest.class);
    }

    public static WorkerResponse decodeResponse(String line) throws JsonProcessingException {
        return JsonValues.MAPPER.readValue(line, WorkerResponse.class);
    }
}
