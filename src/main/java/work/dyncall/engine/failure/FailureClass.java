package work.dyncall.engine.failure;

import java.util.Locale;
import java.util.Set;

/**
 * Attribution of a failure: the generated logic (adaptive), the environment or an upstream (extrinsic),
 * or a declared capability or policy limit (intrinsic).
 */
public enum FailureClass {
    INTRINSIC,
    ADAPTIVE,
    EXTRINSIC;

    private static final Set<String> EXTRINSIC_TYPES = Set.of(
        "timeout",
        "provider",
        "network_error",
        "rate_limit",
        "rate_limited",
        "environment_preparing",
        "worker_crash",
        "dependency_resolution_failed",
        "dependency_install_failed",
        "dependency_activation_failed"
    );
    private static final Set<String> ADAPTIVE_TYPES = Set.of(
        "parse_error",
        "parse_failed",
        "low_utility",
        "wrong_tool_boundary",
        "missing_input",
        "invalid_format",
        "schema_mismatch",
        "contract_violation",
        "guardrail_retry_exhausted",
        "outcome_repair_retry_exhausted"
    );

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies by the outcome's error type first, then by the raised exception.
     */
    public static FailureClass classify(String errorType, Throwable error) {
        String type = errorType == null ? "" : errorType.trim();
        if (EXTRINSIC_TYPES.contains(type)) return EXTRINSIC;
        if (ADAPTIVE_TYPES.contains(type)) return ADAPTIVE;
        if (!type.isEmpty()) return INTRINSIC;
        if (error instanceof DynamicCallException dce
            && (dce.type() == ErrorType.TIMEOUT || dce.type() == ErrorType.PROVIDER)) {
            return EXTRINSIC;
        }
        return INTRINSIC;
    }

    public static FailureClass classify(String errorType) {
        return classify(errorType, null);
    }
}
