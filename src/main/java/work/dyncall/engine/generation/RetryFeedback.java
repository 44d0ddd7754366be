package work.dyncall.engine.generation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.FailureNormalizer;
import work.dyncall.engine.guardrail.GuardrailViolation;

/**
 * Corrective feedback injected into the next fresh-generation prompt after a failed attempt.
 */
public record RetryFeedback(Kind kind, Map<String, Object> fields) {

    public enum Kind {
        GUARDRAIL("guardrail_feedback", "remaining_guardrail_budget",
            "IMPORTANT: Previous attempt violated runtime guardrails.\n"
                + "Regenerate code that satisfies the required correction exactly.\n"
                + "Do not repeat the prohibited mechanism."),
        EXECUTION("execution_failure_feedback", "remaining_execution_repair_budget",
            "IMPORTANT: Previous attempt failed during execution.\n"
                + "Regenerate code that avoids this runtime failure while preserving intended behavior."),
        OUTCOME("outcome_failure_feedback", "remaining_outcome_repair_budget",
            "IMPORTANT: Previous attempt returned a retriable error outcome.\n"
                + "Regenerate code that preserves intended behavior and avoids this outcome failure path.");

        private final String tag;
        private final String budgetField;
        private final String instruction;

        Kind(String tag, String budgetField, String instruction) {
            this.tag = tag;
            this.budgetField = budgetField;
            this.instruction = instruction;
        }

        public String tag() {
            return tag;
        }
    }

    public static RetryFeedback guardrail(GuardrailViolation violation, int attemptNumber, int remaining) {
        Map<String, Object> fields = violation.toMap();
        fields.put("attempt_number", attemptNumber);
        fields.put(Kind.GUARDRAIL.budgetField, remaining);
        return new RetryFeedback(Kind.GUARDRAIL, fields);
    }

    public static RetryFeedback execution(Throwable error, int attemptNumber, int remaining) {
        Throwable root = FailureNormalizer.rootCause(error);
        String rootMessage = root.getMessage() == null ? "" : root.getMessage();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("failure_type", FailureNormalizer.errorTypeOf(error));
        fields.put("failure_message", FailureNormalizer.messageOf(error));
        fields.put("root_error_class", rootErrorClass(error, root));
        fields.put("root_error_message", rootMessage);
        Object location = error instanceof DynamicCallException dce ? dce.metadata().get("failure_location") : null;
        fields.put("failure_location", location == null ? "unknown" : location);
        fields.put("required_correction", executionCorrection(FailureNormalizer.messageOf(error)));
        fields.put("attempt_number", attemptNumber);
        fields.put(Kind.EXECUTION.budgetField, remaining);
        return new RetryFeedback(Kind.EXECUTION, fields);
    }

    public static RetryFeedback outcome(Outcome outcome, int attemptNumber, int remaining) {
        String message = outcome.errorMessage() == null ? "" : outcome.errorMessage();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("failure_type", outcome.errorType() == null ? "execution" : outcome.errorType());
        fields.put("failure_message", message);
        fields.put("root_error_class", outcomeRootClass(message));
        fields.put("root_error_message", message);
        fields.put("required_correction", outcomeCorrection(message));
        fields.put("attempt_number", attemptNumber);
        fields.put(Kind.OUTCOME.budgetField, remaining);
        return new RetryFeedback(Kind.OUTCOME, fields);
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        builder.append('<').append(kind.tag).append(">\n");
        fields.forEach((key, value) -> builder
            .append('<').append(key).append('>')
            .append(value == null ? "" : value)
            .append("</").append(key).append(">\n"));
        builder.append("</").append(kind.tag).append(">\n\n");
        builder.append(kind.instruction).append('\n');
        return builder.toString();
    }

    private static String rootErrorClass(Throwable error, Throwable root) {
        if (error instanceof DynamicCallException dce && dce.metadata().get("root_error_class") != null) {
            return String.valueOf(dce.metadata().get("root_error_class"));
        }
        return root.getClass().getSimpleName();
    }

    static String executionCorrection(String message) {
        String lowered = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lowered.contains("is not a function")) {
            return "Only call functions that exist: use api.delegate(...).call(method, args, kwargs) or api.tool(name) "
                + "for capabilities, and check Outcome objects with `status === \"ok\"` before reading `value`.";
        }
        if (lowered.contains("cannot read properties of undefined") || lowered.contains("cannot read properties of null")) {
            return "Guard against missing values before property access and initialize context slots before reading them.";
        }
        if (lowered.contains("is not defined")) {
            return "Declare every variable with const/let before use; only context, args, kwargs, api and call are in scope.";
        }
        return "Fix the runtime exception path and regenerate code with explicit null and shape checks before member access.";
    }

    static String outcomeCorrection(String message) {
        if (message != null && message.matches("(?is).*\\bvalue\\b.*\\bundefined\\b.*")) {
            return "Unwrap delegated Outcomes before use: branch on `outcome.status === \"ok\"` and read `outcome.value`.";
        }
        return executionCorrection(message);
    }

    private static String outcomeRootClass(String message) {
        if (message.contains("TypeError")) return "TypeError";
        if (message.contains("ReferenceError")) return "ReferenceError";
        return "OutcomeError";
    }
}
