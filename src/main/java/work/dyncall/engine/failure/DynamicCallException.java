package work.dyncall.engine.failure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed engine failure carrying an error type, a retriable flag and diagnostic metadata.
 */
public class DynamicCallException extends RuntimeException {
    private final ErrorType type;
    private final boolean retriable;
    private final Map<String, Object> metadata;

    public DynamicCallException(ErrorType type, String message) {
        this(type, message, type.retriable(), Map.of(), null);
    }

    public DynamicCallException(ErrorType type, String message, Throwable cause) {
        this(type, message, type.retriable(), Map.of(), cause);
    }

    public DynamicCallException(ErrorType type, String message, Map<String, Object> metadata) {
        this(type, message, type.retriable(), metadata, null);
    }

    public DynamicCallException(ErrorType type, String message, boolean retriable, Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.retriable = retriable;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
    }

    public ErrorType type() {
        return type;
    }

    public String errorType() {
        return type.wireName();
    }

    public boolean retriable() {
        return retriable;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public DynamicCallException withRetriable(boolean value) {
        return new DynamicCallException(type, getMessage(), value, metadata, getCause());
    }
}
