package work.dyncall.engine.failure;

import java.util.Locale;

/**
 * Error types raised by the engine itself. Programs may still return arbitrary domain error types.
 */
public enum ErrorType {
    BUDGET_EXCEEDED(false),
    TIMEOUT(true),
    PROVIDER(true),
    INVALID_CODE(true),
    INVALID_DEPENDENCY_MANIFEST(false),
    DEPENDENCY_MANIFEST_INCOMPATIBLE(false),
    DEPENDENCY_POLICY_VIOLATION(false),
    DEPENDENCY_RESOLUTION_FAILED(false),
    DEPENDENCY_INSTALL_FAILED(true),
    DEPENDENCY_ACTIVATION_FAILED(true),
    ENVIRONMENT_PREPARING(true),
    TOOL_REGISTRY_VIOLATION(false),
    GUARDRAIL_RETRY_EXHAUSTED(false),
    OUTCOME_REPAIR_RETRY_EXHAUSTED(false),
    WORKER_CRASH(true),
    NON_SERIALIZABLE_RESULT(false),
    CONTRACT_VIOLATION(false),
    LOW_UTILITY(false),
    EXECUTION(false);

    private final boolean retriable;

    ErrorType(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean retriable() {
        return retriable;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ErrorType fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXECUTION;
        }
        for (ErrorType type : values()) {
            if (type.wireName().equals(raw.trim())) {
                return type;
            }
        }
        return EXECUTION;
    }
}
