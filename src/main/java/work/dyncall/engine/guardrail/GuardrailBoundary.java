package work.dyncall.engine.guardrail;

import java.util.LinkedHashMap;
import java.util.Map;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.ErrorType;

/**
 * Replaces the message of a guardrail-exhaustion outcome with a generic one, at the top-level call only.
 * The raw message and violation details move into metadata; nested calls keep everything as is.
 */
public final class GuardrailBoundary {
    public static final String NORMALIZATION_POLICY = "guardrail_exhaustion_boundary_v1";
    public static final String USER_MESSAGE = "This request couldn't be completed after multiple attempts.";

    private GuardrailBoundary() {}

    public static Outcome normalize(Outcome outcome, int depth) {
        if (outcome == null || outcome.isOk() || depth != 0) {
            return outcome;
        }
        if (!ErrorType.GUARDRAIL_RETRY_EXHAUSTED.wireName().equals(outcome.errorType())) {
            return outcome;
        }
        Map<String, Object> metadata = new LinkedHashMap<>(outcome.metadata());
        metadata.put("normalized", true);
        metadata.put("normalization_policy", NORMALIZATION_POLICY);
        metadata.putIfAbsent("guardrail_class", GuardrailViolation.RECOVERABLE);
        Object subtype = metadata.get("last_violation_subtype");
        metadata.put("guardrail_subtype", subtype == null ? GuardrailViolation.UNKNOWN_SUBTYPE : subtype);
        metadata.putIfAbsent("raw_error_message", outcome.errorMessage());
        return outcome.withMetadata(metadata).withErrorMessage(USER_MESSAGE);
    }
}
