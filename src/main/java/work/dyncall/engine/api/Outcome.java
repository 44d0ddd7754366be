package work.dyncall.engine.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.FailureNormalizer;

/**
 * The single result type of every invocation: either {@code ok(value)} or
 * {@code error(type, message, retriable, metadata)}.
 */
public record Outcome(
    Status status,
    Object value,
    String errorType,
    String errorMessage,
    boolean retriable,
    Map<String, Object> metadata,
    String role,
    String method
) {
    /** Key under which an outcome travels through plain JSON (worker IPC). */
    public static final String ENCODED_KEY = "__outcome__";

    public Outcome {
        Objects.requireNonNull(status, "status");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
    }

    public static Outcome ok(Object value, String role, String method) {
        return new Outcome(Status.OK, value, null, null, false, Map.of(), role, method);
    }

    public static Outcome error(String errorType, String errorMessage, boolean retriable, String role, String method) {
        return error(errorType, errorMessage, retriable, Map.of(), role, method);
    }

    public static Outcome error(
        String errorType,
        String errorMessage,
        boolean retriable,
        Map<String, Object> metadata,
        String role,
        String method
    ) {
        String type = errorType == null || errorType.isBlank() ? "execution" : errorType;
        return new Outcome(Status.ERROR, null, type, errorMessage == null ? "" : errorMessage, retriable, metadata, role, method);
    }

    public static Outcome fromException(Throwable error, String role, String method) {
        Map<String, Object> metadata = error instanceof DynamicCallException dce ? dce.metadata() : Map.of();
        return error(
            FailureNormalizer.errorTypeOf(error),
            FailureNormalizer.messageOf(error),
            FailureNormalizer.retriableOf(error),
            metadata,
            role,
            method
        );
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public Object valueOr(Object fallback) {
        return isOk() ? value : fallback;
    }

    public Outcome withErrorMessage(String message) {
        return new Outcome(status, value, errorType, message, retriable, metadata, role, method);
    }

    public Outcome withMetadata(Map<String, Object> newMetadata) {
        return new Outcome(status, value, errorType, errorMessage, retriable, newMetadata, role, method);
    }

    public Outcome withRetriable(boolean value) {
        return new Outcome(status, this.value, errorType, errorMessage, value, metadata, role, method);
    }

    public Outcome attributedTo(String newRole, String newMethod) {
        return new Outcome(status, value, errorType, errorMessage, retriable, metadata,
            role == null ? newRole : role, method == null ? newMethod : method);
    }

    /**
     * Plain-map view, used for the scripting surface, the worker wire format and call records.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.wireName());
        map.put("ok", isOk());
        if (isOk()) {
            map.put("value", value);
        } else {
            map.put("error_type", errorType);
            map.put("error_message", errorMessage);
            map.put("retriable", retriable);
            if (!metadata.isEmpty()) {
                map.put("metadata", metadata);
            }
        }
        map.put("role", role);
        map.put("method", method);
        return map;
    }

    public Map<String, Object> encode() {
        return Map.of(ENCODED_KEY, toMap());
    }

    /**
     * Normalizes a raw program return value into an outcome. Explicit outcomes pass through, encoded
     * outcomes are decoded, error-shaped mappings become errors and anything else is a success value.
     */
    public static Outcome coerce(Object raw, String role, String method) {
        if (raw instanceof Outcome outcome) {
            return outcome.attributedTo(role, method);
        }
        if (raw instanceof Map<?, ?> map) {
            Object encoded = map.get(ENCODED_KEY);
            if (encoded instanceof Map<?, ?> encodedMap && map.size() == 1) {
                return decode(encodedMap, role, method);
            }
            if (isErrorShaped(map)) {
                return decode(map, role, method);
            }
        }
        return ok(raw, role, method);
    }

    private static boolean isErrorShaped(Map<?, ?> map) {
        Object type = map.containsKey("error_type") ? map.get("error_type") : map.get("errorType");
        if (!(type instanceof String str) || str.isBlank()) {
            return false;
        }
        return "error".equals(map.get("status")) || Boolean.FALSE.equals(map.get("ok"));
    }

    private static Outcome decode(Map<?, ?> encoded, String role, String method) {
        String encodedRole = encoded.get("role") instanceof String r ? r : role;
        String encodedMethod = encoded.get("method") instanceof String m ? m : method;
        boolean ok = "ok".equals(encoded.get("status")) || Boolean.TRUE.equals(encoded.get("ok"));
        if (ok) {
            return ok(encoded.get("value"), encodedRole, encodedMethod);
        }
        Object type = encoded.containsKey("error_type") ? encoded.get("error_type") : encoded.get("errorType");
        Object message = encoded.containsKey("error_message") ? encoded.get("error_message") : encoded.get("errorMessage");
        if (message == null) {
            message = encoded.get("message");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (encoded.get("metadata") instanceof Map<?, ?> meta) {
            meta.forEach((k, v) -> metadata.put(String.valueOf(k), v));
        }
        return error(
            type == null ? "execution" : String.valueOf(type),
            message == null ? "Program returned error outcome" : String.valueOf(message),
            Boolean.TRUE.equals(encoded.get("retriable")),
            metadata,
            encodedRole,
            encodedMethod
        );
    }

    @Override
    public String toString() {
        return isOk() ? String.valueOf(value) : "[" + errorType + "] " + errorMessage;
    }

    public enum Status {
        OK,
        ERROR;

        public String wireName() {
            return this == OK ? "ok" : "error";
        }
    }
}
