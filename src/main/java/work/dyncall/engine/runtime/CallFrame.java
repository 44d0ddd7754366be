package work.dyncall.engine.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import work.dyncall.engine.shared.Hashing;

/**
 * Identity of one invocation within a call tree.
 *
 * @param traceId shared by every nested call of a top-level invocation
 * @param callId 16 hex characters, unique per invocation
 * @param parentCallId {@code null} at the top level
 * @param depth 0 at the top level
 */
public record CallFrame(String traceId, String callId, String parentCallId, int depth) {

    public static CallFrame root() {
        return new CallFrame(Hashing.randomHex(16), Hashing.randomHex(8), null, 0);
    }

    /** Fresh call id within an existing trace, used for each call made through one agent handle. */
    public CallFrame next() {
        return new CallFrame(traceId, Hashing.randomHex(8), parentCallId, depth);
    }

    public CallFrame child() {
        return new CallFrame(traceId, Hashing.randomHex(8), callId, depth + 1);
    }

    public boolean topLevel() {
        return depth == 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("trace_id", traceId);
        map.put("call_id", callId);
        map.put("parent_call_id", parentCallId);
        map.put("depth", depth);
        return map;
    }
}
