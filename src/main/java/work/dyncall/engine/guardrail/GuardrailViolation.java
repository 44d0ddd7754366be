package work.dyncall.engine.guardrail;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.failure.FailureNormalizer;

/**
 * Stable violation record shared by every guardrail check.
 */
public record GuardrailViolation(
    String violationType,
    String subtype,
    String message,
    String requiredCorrection,
    String guardrailClass,
    String location
) {
    public static final String RECOVERABLE = "recoverable_guardrail";
    public static final String TERMINAL = "terminal_guardrail";
    public static final String UNKNOWN_SUBTYPE = "unknown_guardrail_violation";

    public GuardrailViolation {
        violationType = violationType == null ? ErrorType.TOOL_REGISTRY_VIOLATION.wireName() : violationType;
        subtype = subtype == null || subtype.isBlank() ? UNKNOWN_SUBTYPE : subtype;
        Objects.requireNonNull(message, "message");
        requiredCorrection = requiredCorrection == null
            ? "Rewrite using policy-compliant api.tool/api.delegate invocation paths and keep registry metadata plain."
            : requiredCorrection;
        guardrailClass = guardrailClass == null ? classify(message) : guardrailClass;
    }

    public static GuardrailViolation of(String subtype, String message, String requiredCorrection) {
        return new GuardrailViolation(null, subtype, message, requiredCorrection, null, null);
    }

    /** Rebuilds a violation from a raised error that did not come from a check. */
    public static GuardrailViolation fromException(DynamicCallException error) {
        Object subtype = error.metadata().get("guardrail_subtype");
        Object correction = error.metadata().get("required_correction");
        return new GuardrailViolation(error.errorType(), subtype == null ? null : String.valueOf(subtype), FailureNormalizer.messageOf(error),
            correction == null ? null : String.valueOf(correction), null, null);
    }

    public boolean terminal() {
        return TERMINAL.equals(guardrailClass);
    }

    public DynamicCallException toException() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("guardrail_class", guardrailClass);
        metadata.put("guardrail_subtype", subtype);
        metadata.put("required_correction", requiredCorrection);
        return new DynamicCallException(ErrorType.TOOL_REGISTRY_VIOLATION, message, false, metadata, null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("guardrail_class", guardrailClass);
        map.put("violation_type", violationType);
        map.put("violation_subtype", subtype);
        map.put("violation_message", message);
        map.put("violation_location", location == null ? "unknown" : location);
        map.put("required_correction", requiredCorrection);
        return map;
    }

    private static String classify(String message) {
        return FailureNormalizer.terminalGuardrailMessage(message) ? TERMINAL : RECOVERABLE;
    }
}
