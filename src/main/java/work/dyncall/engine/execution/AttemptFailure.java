package work.dyncall.engine.execution;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One failed attempt inside an invocation. Entries are appended, never rewritten.
 */
public record AttemptFailure(
    int attemptId,
    Stage stage,
    String errorClass,
    String errorMessage,
    String failureClass,
    String timestamp,
    String callId
) {
    public static final int MAX_RECORDED = 8;
    public static final int MAX_MESSAGE_LENGTH = 400;

    public enum Stage {
        VALIDATION,
        GUARDRAIL,
        EXECUTION,
        OUTCOME_POLICY;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public AttemptFailure {
        stage = stage == null ? Stage.EXECUTION : stage;
        errorMessage = truncate(errorMessage);
    }

    static String truncate(String message) {
        String normalized = message == null ? "" : message;
        if (normalized.length() <= MAX_MESSAGE_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("attempt_id", attemptId);
        map.put("stage", stage.wireName());
        map.put("error_class", errorClass);
        map.put("error_message", errorMessage);
        map.put("failure_class", failureClass);
        map.put("timestamp", timestamp);
        map.put("call_id", callId);
        return map;
    }
}
