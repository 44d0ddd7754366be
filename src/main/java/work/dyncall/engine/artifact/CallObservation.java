package work.dyncall.engine.artifact;

import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.FailureClass;
import work.dyncall.engine.guardrail.ContinuityReport;

/**
 * What one finished call tells the artifact about the program that produced it.
 */
public record CallObservation(
    String traceId,
    String code,
    Outcome outcome,
    FailureClass failureClass,
    String failureMessage,
    boolean contractApplied,
    Boolean contractPassed,
    boolean guardrailRetryExhausted,
    boolean outcomeRetryExhausted,
    ContinuityReport continuity
) {
    public boolean ok() {
        return outcome != null && outcome.isOk();
    }

    public String status() {
        return ok() ? "ok" : "error";
    }

    public String errorType() {
        return outcome == null || outcome.errorType() == null ? "" : outcome.errorType();
    }

    public String errorMessage() {
        if (outcome != null && outcome.errorMessage() != null) {
            return outcome.errorMessage();
        }
        return failureMessage == null ? "unknown failure" : failureMessage;
    }
}
