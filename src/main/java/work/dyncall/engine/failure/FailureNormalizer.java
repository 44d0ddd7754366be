package work.dyncall.engine.failure;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps raised failures to their wire error type and diagnostic fields.
 */
public final class FailureNormalizer {
    private static final Pattern[] TERMINAL_GUARDRAIL_PATTERNS = {
        Pattern.compile("missing credential", Pattern.CASE_INSENSITIVE),
        Pattern.compile("api key", Pattern.CASE_INSENSITIVE),
        Pattern.compile("unsupported runtime capability", Pattern.CASE_INSENSITIVE),
        Pattern.compile("external service unavailable", Pattern.CASE_INSENSITIVE)
    };

    private FailureNormalizer() {}

    public static String errorTypeOf(Throwable error) {
        if (error instanceof DynamicCallException dce) {
            return dce.errorType();
        }
        return ErrorType.EXECUTION.wireName();
    }

    public static boolean retriableOf(Throwable error) {
        if (error instanceof DynamicCallException dce) {
            return dce.retriable();
        }
        return false;
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public static Throwable rootCause(Throwable error) {
        Throwable cursor = error;
        while (cursor != null && cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    public static boolean terminalGuardrailMessage(String message) {
        if (message == null) return false;
        for (Pattern pattern : TERMINAL_GUARDRAIL_PATTERNS) {
            if (pattern.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    public static Map<String, Object> normalize(Throwable error) {
        var map = new LinkedHashMap<String, Object>();
        map.put("error_type", errorTypeOf(error));
        map.put("error_message", messageOf(error));
        map.put("retriable", retriableOf(error));
        if (error instanceof DynamicCallException dce && !dce.metadata().isEmpty()) {
            map.put("metadata", dce.metadata());
        }
        return map;
    }
}
